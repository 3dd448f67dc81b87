package com.convocommerce.pii.config;

import com.convocommerce.pii.domain.NonCriticalFailureMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.List;

@Data
@Validated
@ConfigurationProperties(prefix = "pii")
public class PiiTokenizationProperties {

    @Valid
    private Aws aws = new Aws();

    @Valid
    private Kms kms = new Kms();

    @Valid
    private TokenStore tokenStore = new TokenStore();

    @Valid
    private Tokens tokens = new Tokens();

    @Valid
    private Structural structural = new Structural();

    @Valid
    private Payment payment = new Payment();

    @Valid
    private Conversation conversation = new Conversation();

    @Data
    public static class Aws {
        @NotBlank
        private String region = "us-east-1";

        /** LocalStack or VPC endpoint; blank means the SDK default. */
        private String endpointOverride;
    }

    @Data
    public static class Kms {
        @NotBlank
        private String keyId = "alias/pii-encryption-key";
    }

    @Data
    public static class TokenStore {
        @NotBlank
        private String tableName = "pii-token-mappings";

        private boolean nativeTtlEnabled = true;
    }

    @Data
    public static class Tokens {
        @Min(1)
        private int maxMintAttempts = 3;
    }

    @Data
    public static class Structural {
        @NotEmpty
        private List<String> sensitiveFields = new ArrayList<>(List.of(
                "email", "phone", "address", "creditCard", "ssn",
                "firstName", "lastName", "fullName", "paymentMethod",
                "cardNumber", "cvv", "expiryDate"));
    }

    @Data
    public static class Payment {
        @NotEmpty
        private List<String> criticalFields = new ArrayList<>(List.of(
                "card_number", "cvv", "expiry_date", "payment_method_id", "payment_token"));

        private List<String> nonCriticalFields = new ArrayList<>(List.of("billing_address"));

        @Min(1)
        private int tokenTtlHours = 24;

        @NotNull
        private NonCriticalFailureMode nonCriticalFailureMode = NonCriticalFailureMode.REDACT;
    }

    @Data
    public static class Conversation {
        @Min(1)
        private int tokenTtlHours = 168;

        @NotEmpty
        private List<String> sensitiveFields = new ArrayList<>(List.of(
                "email", "phone", "address", "creditCard", "ssn",
                "firstName", "lastName", "fullName", "paymentMethod",
                "cardNumber", "cvv", "expiryDate"));
    }
}
