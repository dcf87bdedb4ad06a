package io.fieldtree.cli.dto;

import java.util.List;

/**
 * Schema type graph file:
 * <pre>
 * {"queryType": "Query",
 *  "types": [{"name": "Droid", "kind": "OBJECT",
 *             "fields": [{"name": "id", "type": "ID!"}, {"name": "serial", "type": "String", "deprecationReason": "use id"}]},
 *            {"name": "Character", "kind": "INTERFACE", "possibleTypes": ["Human", "Droid"], "fields": [...]},
 *            {"name": "Episode", "kind": "ENUM", "enumValues": ["NEWHOPE", "EMPIRE", "JEDI"]}]}
 * </pre>
 */
public class SchemaJson {
    public String queryType;
    public String mutationType;
    public String subscriptionType;
    public List<TypeJson> types;

    public static class TypeJson {
        public String name;
        public String kind;
        public List<FieldJson> fields;
        public List<String> possibleTypes;
        public List<String> enumValues;
    }

    public static class FieldJson {
        public String name;
        public String type;
        public String deprecationReason;
    }
}
