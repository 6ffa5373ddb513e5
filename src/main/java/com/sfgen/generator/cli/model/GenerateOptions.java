package com.sfgen.generator.cli.model;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Holds the options of one generation. Used directly on the command line
 * and for every {@code --gen} string. No validation, no execution logic, no
 * printing.
 *
 * Every option also accepts the single-dash spelling used in existing
 * {@code //go:generate} directives ({@code -struct Person}).
 */
@Getter
public class GenerateOptions {

	@Option(names = { "--struct", "-struct" }, description = "The struct to use as the source for code generation. REQUIRED")
	private String struct;

	@Option(names = { "--src-dir", "-src-dir" }, defaultValue = ".",
			description = "The directory containing the --struct. Defaults to the current directory")
	private String srcDir;

	@Option(names = { "--package", "-package" }, description = "The name of the package in which the source struct resides.")
	private String packageName;

	@Option(names = { "--tests", "-tests" }, arity = "0..1",
			description = "If true, source code in tests will be included. Often needed along with --package.")
	private boolean tests;

	@Option(names = { "--tag", "-tag" }, description = {
			"If provided, the provided tag will be parsed for each field on the --struct.",
			"If the tag is missing, the struct field's name is used.",
			"Otherwise, the first attribute in the tag is used as the name." })
	private String tag;

	@Option(names = { "--tag-regex", "-tag-regex" }, description = {
			"Requires --tag. The regex is tested on the tag contents of each field;",
			"its first capture group becomes the constant value.",
			"If the regex does not match, the struct field's name is used instead." })
	private String tagRegex;

	@Option(names = { "--prefix", "-prefix" },
			description = "A value to prepend to the generated const names. Defaults to [tag]Field. May be given once.")
	private String prefix;

	@Option(names = { "--style", "-style" },
			description = "The style of constants desired. Valid options are: alias, typed, generic")
	private String style;

	@Option(names = { "--export", "-export" }, arity = "0..1",
			description = "If true, the generated constants will be exported")
	private boolean export;

	@Option(names = { "--include-struct-name", "-include-struct-name" }, arity = "0..1",
			description = "If true, the generated constants will be prefixed with the source struct name")
	private boolean includeStructName;

	@Option(names = { "--include-unexported-fields", "-include-unexported-fields" }, arity = "0..1",
			description = "If true, the generated constants will include fields that are not exported on the struct")
	private boolean includeUnexportedFields;

	@Option(names = { "--iter", "-iter" }, arity = "0..1",
			description = "If true, an All() method returning an array of every generated value is added to the type")
	private boolean iter;

	@Option(names = { "--out-dir", "-out-dir" }, defaultValue = ".",
			description = "The directory in which to place the generated file. Defaults to the current directory")
	private String outDir;

	@Option(names = { "--out-file", "-out-file" },
			description = "The file to write generated output to. Defaults to [struct]_[prefix]_generated.go")
	private String outFile;

	@Option(names = { "--out-pkg", "-out-pkg" },
			description = "The package the generated code should belong to. Defaults to $GOPACKAGE")
	private String outPkg;

	@Option(names = { "--dry-run", "-dry-run" }, arity = "0..1",
			description = "If true, nothing is written; the generated files are printed to standard output instead")
	private boolean dryRun;
}
