package io.fieldtree.cli.dto;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Map;

/**
 * One selection; {@code kind} is {@code Field}, {@code FragmentSpread} or {@code InlineFragment}.
 * Unused members stay null.
 */
public class SelectionJson {
    public String kind;
    public String alias;
    public String name;
    public String typeCondition;
    public Map<String, JsonNode> arguments;
    public List<DirectiveJson> directives;
    public List<SelectionJson> selections;
    public Integer line;
    public Integer column;

    public static class DirectiveJson {
        public String name;
        public Map<String, JsonNode> arguments;
    }
}
