package io.fieldtree.cli.dto;

import java.util.Map;

/** Compiler options file; absent members keep their defaults. */
public class CompilerOptionsJson {
    public Boolean addTypename;
    public Boolean warnOnDeprecatedUsages;
    public Boolean failOnWarnings;
    public String deferDirectiveName;
    public Map<String, String> customScalarsMapping;
}
