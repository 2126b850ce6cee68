// file: server/src/main/java/io/planbridge/server/dto/SchemaDocument.java
package io.planbridge.server.dto;

import java.util.Map;

/**
 * JSON form of the resource schemas a bridge serves.
 * Example:
 *   {
 *     "resources": {
 *       "prov:index/test:Test": {
 *         "deleteBeforeReplace": false,
 *         "properties": {
 *           "name": { "type": "string", "required": true, "forceNew": true },
 *           "tags": { "type": "set", "optional": true, "elem": { "type": "string" } }
 *         }
 *       }
 *     }
 *   }
 */
public class SchemaDocument {
    public Map<String, Resource> resources;

    public static class Resource {
        public boolean deleteBeforeReplace;
        public Map<String, Field> properties;
    }

    public static class Field {
        public String type;                 // string | number | bool | list | set | map | block
        public Field elem;                  // list, set, map
        public Map<String, Field> fields;   // block
        public boolean required;
        public boolean optional;
        public boolean computed;
        public boolean forceNew;
        public boolean sensitive;
        public boolean maxItemsOne;         // list/set of block collapsed to a single object
    }
}
