// file: server/src/main/java/io/planbridge/server/dto/PreviewRequest.java
package io.planbridge.server.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * JSON body for POST /preview.
 * Example:
 *   {
 *     "type": "prov:index/test:Test",
 *     "name": "res",
 *     "olds": { "tests": ["val1"] },
 *     "news": { "tests": ["val2"] },
 *     "ignoreChanges": ["labels"]
 *   }
 * A missing or null "olds" previews a create.
 */
public class PreviewRequest {
    public String type;
    public String name;
    public JsonNode olds;
    public JsonNode news;
    public List<String> ignoreChanges;
}
