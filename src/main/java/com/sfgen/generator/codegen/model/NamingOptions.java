package com.sfgen.generator.codegen.model;

import lombok.Builder;
import lombok.Value;

/**
 * Options that drive the names of generated types and constants.
 */
@Value
@Builder(toBuilder = true)
public class NamingOptions {

    /**
     * Replaces the derived {@code [Struct][TAG]Field} prefix when set.
     */
    String explicitPrefix;

    boolean includeRecordNameInPrefix;

    boolean exportCasing;

    boolean enumerationHelperRequested;
}
