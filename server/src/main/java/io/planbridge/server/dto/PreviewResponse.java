package io.planbridge.server.dto;

import java.util.Map;

/** JSON response of POST /preview. */
public class PreviewResponse {
    public boolean replace;
    public Map<String, String> detailedDiff; // path -> ADD | UPDATE_REPLACE | ...
    public String preview;
}
