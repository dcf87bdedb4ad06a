package io.fieldtree.cli.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * Parsed document file: operations and fragment definitions as selection trees.
 * Argument and default values are plain JSON; a variable reference is written
 * {@code {"kind": "Variable", "variableName": "id"}}.
 */
public class DocumentJson {
    public List<OperationJson> operations;
    public List<FragmentJson> fragments;

    public static class OperationJson {
        public String operationType;
        public String name;
        public List<VariableJson> variables;
        public List<SelectionJson> selections;
        public Integer line;
        public Integer column;
    }

    public static class FragmentJson {
        public String name;
        public String typeCondition;
        public List<SelectionJson> selections;
        public Integer line;
        public Integer column;
    }

    public static class VariableJson {
        public String name;
        public String type;
        public JsonNode defaultValue;
    }
}
