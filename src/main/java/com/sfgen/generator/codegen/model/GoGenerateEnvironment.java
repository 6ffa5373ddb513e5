package com.sfgen.generator.codegen.model;

import java.util.Map;

import com.sfgen.generator.parser.BuildContext;

import lombok.Builder;
import lombok.Value;

/**
 * Variables {@code go generate} sets for the commands it runs. Each is
 * {@code null} when the tool is run by hand.
 */
@Value
@Builder
public class GoGenerateEnvironment {

    public static final String GOPACKAGE = "GOPACKAGE";
    public static final String GOFILE = "GOFILE";
    public static final String GOLINE = "GOLINE";

    /** Package of the file holding the directive. */
    String goPackage;

    /** Base name of the file holding the directive. */
    String goFile;

    /** Line number of the directive. */
    String goLine;

    /** Target operating system; the host's when unset. */
    String goos;

    /** Target architecture; the host's when unset. */
    String goarch;

    public static GoGenerateEnvironment fromSystem() {
        return fromMap(System.getenv());
    }

    public static GoGenerateEnvironment fromMap(Map<String, String> variables) {
        return GoGenerateEnvironment.builder()
                .goPackage(variables.get(GOPACKAGE))
                .goFile(variables.get(GOFILE))
                .goLine(variables.get(GOLINE))
                .goos(variables.get(BuildContext.GOOS))
                .goarch(variables.get(BuildContext.GOARCH))
                .build();
    }

    /**
     * Platform whose files make up the packages being loaded.
     */
    public BuildContext buildContext() {
        return BuildContext.of(goos, goarch);
    }

    public boolean isInvokedByGoGenerate() {
        return goFile != null && !goFile.isEmpty();
    }

    /**
     * {@code GOPACKAGE.GOFILE:GOLINE}, naming the directive that produced a
     * file.
     */
    public String directiveLocation() {
        return nullToEmpty(goPackage) + "." + nullToEmpty(goFile) + ":" + nullToEmpty(goLine);
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
