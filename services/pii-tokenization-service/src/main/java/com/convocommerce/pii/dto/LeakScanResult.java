package com.convocommerce.pii.dto;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Value;

import java.util.List;

@Value
public class LeakScanResult {

    boolean clean;
    List<String> violations;

    /** Redacted copy of the scanned record; the input itself when clean. */
    JsonNode sanitizedData;
}
