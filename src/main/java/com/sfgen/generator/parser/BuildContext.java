package com.sfgen.generator.parser;

import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

import lombok.NonNull;
import lombok.Value;

/**
 * Target platform used to decide which files of a package take part in a
 * build: the file name suffix rule ({@code _linux.go}, {@code _windows_amd64.go})
 * and the tags of build constraint expressions.
 *
 * No custom build tags are set, so files constrained to one (including
 * {@code ignore}) are left out.
 */
@Value
public class BuildContext {

    public static final String GOOS = "GOOS";
    public static final String GOARCH = "GOARCH";

    private static final Set<String> KNOWN_OS = Set.of(
            "aix", "android", "darwin", "dragonfly", "freebsd", "hurd", "illumos", "ios", "js", "linux",
            "nacl", "netbsd", "openbsd", "plan9", "solaris", "wasip1", "windows", "zos");

    private static final Set<String> KNOWN_ARCH = Set.of(
            "386", "amd64", "amd64p32", "arm", "armbe", "arm64", "arm64be", "loong64", "mips", "mipsle",
            "mips64", "mips64le", "mips64p32", "mips64p32le", "ppc", "ppc64", "ppc64le", "riscv", "riscv64",
            "s390", "s390x", "sparc", "sparc64", "wasm");

    private static final Set<String> UNIX_OS = Set.of(
            "aix", "android", "darwin", "dragonfly", "freebsd", "hurd", "illumos", "ios", "linux",
            "netbsd", "openbsd", "solaris");

    private static final Pattern RELEASE_TAG = Pattern.compile("go1\\.[0-9]+");

    @NonNull
    String goos;

    @NonNull
    String goarch;

    /**
     * Context for the given platform; a missing or empty value falls back to
     * the platform the tool runs on.
     */
    public static BuildContext of(String goos, String goarch) {
        BuildContext host = host();
        return new BuildContext(
                goos == null || goos.isBlank() ? host.getGoos() : goos.strip(),
                goarch == null || goarch.isBlank() ? host.getGoarch() : goarch.strip());
    }

    public static BuildContext fromEnvironment(Map<String, String> variables) {
        return of(variables.get(GOOS), variables.get(GOARCH));
    }

    public static BuildContext host() {
        String osName = System.getProperty("os.name", "").toLowerCase(Locale.ROOT);
        String goos;
        if (osName.startsWith("windows")) {
            goos = "windows";
        } else if (osName.startsWith("mac") || osName.startsWith("darwin")) {
            goos = "darwin";
        } else if (osName.startsWith("freebsd")) {
            goos = "freebsd";
        } else if (osName.startsWith("sunos") || osName.startsWith("solaris")) {
            goos = "solaris";
        } else if (osName.startsWith("aix")) {
            goos = "aix";
        } else {
            goos = "linux";
        }

        String osArch = System.getProperty("os.arch", "").toLowerCase(Locale.ROOT);
        String goarch = switch (osArch) {
            case "x86", "i386", "i486", "i586", "i686" -> "386";
            case "aarch64", "arm64" -> "arm64";
            case "arm", "arm32" -> "arm";
            case "ppc64le" -> "ppc64le";
            case "ppc64" -> "ppc64";
            case "s390x" -> "s390x";
            case "riscv64" -> "riscv64";
            case "loongarch64" -> "loong64";
            default -> "amd64";
        };
        return new BuildContext(goos, goarch);
    }

    /**
     * Whether a build constraint tag is satisfied.
     */
    public boolean hasTag(String tag) {
        if (tag.equals(goos) || tag.equals(goarch) || tag.equals("gc")) {
            return true;
        }
        if (tag.equals("unix")) {
            return UNIX_OS.contains(goos);
        }
        // GOOS=android also builds linux files, GOOS=illumos solaris files, GOOS=ios darwin files.
        if ((tag.equals("linux") && goos.equals("android"))
                || (tag.equals("solaris") && goos.equals("illumos"))
                || (tag.equals("darwin") && goos.equals("ios"))) {
            return true;
        }
        return RELEASE_TAG.matcher(tag).matches();
    }

    /**
     * Applies the {@code name_GOOS_GOARCH.go} rule. The first element of the
     * name never counts, so {@code linux.go} is not constrained.
     */
    public boolean matchesFileName(String fileName) {
        String name = fileName;
        if (name.endsWith(".go")) {
            name = name.substring(0, name.length() - ".go".length());
        }
        if (name.endsWith("_test")) {
            name = name.substring(0, name.length() - "_test".length());
        }
        int underscore = name.indexOf('_');
        if (underscore < 0) {
            return true;
        }
        String[] parts = name.substring(underscore + 1).split("_", -1);
        int n = parts.length;
        if (n >= 2 && KNOWN_OS.contains(parts[n - 2]) && KNOWN_ARCH.contains(parts[n - 1])) {
            return hasTag(parts[n - 2]) && hasTag(parts[n - 1]);
        }
        if (KNOWN_OS.contains(parts[n - 1]) || KNOWN_ARCH.contains(parts[n - 1])) {
            return hasTag(parts[n - 1]);
        }
        return true;
    }
}
