package com.sfgen.generator.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

import com.sfgen.generator.cli.exception.OptionsValidationException;
import com.sfgen.generator.cli.model.GenerateOptions;
import com.sfgen.generator.cli.model.ValidatedGenerateOptions;
import com.sfgen.generator.codegen.catalog.GoModuleLocator;
import com.sfgen.generator.codegen.model.ConstantStyle;
import com.sfgen.generator.codegen.model.GenerationRequest;
import com.sfgen.generator.codegen.model.GoGenerateEnvironment;
import com.sfgen.generator.codegen.model.NamingOptions;
import com.sfgen.generator.codegen.model.SourceLocation;
import com.sfgen.generator.codegen.naming.ConstantNamingEngine;

/**
 * Checks parsed options and turns them into generation requests.
 *
 * All errors of all option sets are collected before anything is reported.
 */
public class GenerateOptionsValidator {

	private static final String EXTERNAL_TEST_SUFFIX = "_test";

	private final GoModuleLocator moduleLocator;

	public GenerateOptionsValidator() {
		this(new GoModuleLocator());
	}

	public GenerateOptionsValidator(GoModuleLocator moduleLocator) {
		this.moduleLocator = moduleLocator;
	}

	public ValidatedGenerateOptions validate(List<GenerateOptions> optionSets, GoGenerateEnvironment environment) {
		List<String> errors = new ArrayList<>();
		List<GenerationRequest> requests = new ArrayList<>();
		boolean dryRun = false;

		for (int i = 0; i < optionSets.size(); i++) {
			GenerateOptions o = optionSets.get(i);
			String context = optionSets.size() > 1 ? "--gen #" + (i + 1) + ": " : "";
			List<String> setErrors = new ArrayList<>();
			GenerationRequest request = validateOne(o, environment, setErrors);
			setErrors.forEach(error -> errors.add(context + error));
			if (request != null) {
				requests.add(request);
			}
			dryRun |= o.isDryRun();
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}
		return new ValidatedGenerateOptions(requests, dryRun);
	}

	private GenerationRequest validateOne(GenerateOptions o, GoGenerateEnvironment environment, List<String> errors) {
		if (isBlank(o.getStruct())) {
			errors.add("--struct is required");
		}
		if (isBlank(o.getSrcDir())) {
			errors.add("--src-dir must not be empty");
		} else if (!Files.isDirectory(Path.of(o.getSrcDir()))) {
			errors.add("--src-dir does not exist or is not a directory: " + o.getSrcDir());
		}

		String outputPackage = o.getOutPkg() != null ? o.getOutPkg() : environment.getGoPackage();
		if (isBlank(outputPackage)) {
			errors.add("--out-pkg must not be empty");
		}
		if (isBlank(o.getOutDir())) {
			errors.add("--out-dir must not be empty");
		}

		Optional<ConstantStyle> style = ConstantStyle.fromFlagValue(o.getStyle());
		if (style.isEmpty()) {
			errors.add("--style must be one of [alias, typed, generic], got \"" + o.getStyle() + "\"");
		}

		if (isBlank(o.getTag()) && !isBlank(o.getTagRegex())) {
			errors.add("cannot use tag regex \"" + o.getTagRegex() + "\" with an empty tag");
		}
		if (!isBlank(o.getTagRegex())) {
			try {
				Pattern.compile(o.getTagRegex());
			} catch (PatternSyntaxException e) {
				errors.add("--tag-regex is not a valid regular expression: " + e.getDescription());
			}
		}

		if (o.getPrefix() != null && o.getPrefix().isEmpty()) {
			errors.add("--prefix must not be empty");
		}

		if (!errors.isEmpty()) {
			return null;
		}

		NamingOptions namingOptions = NamingOptions.builder()
				.explicitPrefix(o.getPrefix())
				.includeRecordNameInPrefix(o.isIncludeStructName())
				.exportCasing(o.isExport())
				.enumerationHelperRequested(o.isIter())
				.build();
		String tag = isBlank(o.getTag()) ? null : o.getTag();
		String baseName = ConstantNamingEngine.baseName(namingOptions, tag, o.getStruct());
		String outFile = isBlank(o.getOutFile())
				? ConstantNamingEngine.defaultOutputFileName(o.getStruct(), baseName)
				: o.getOutFile();
		Path outDir = Path.of(o.getOutDir()).toAbsolutePath().normalize();

		return GenerationRequest.builder()
				.sourceLocation(SourceLocation.of(Path.of(o.getSrcDir()), o.getPackageName(), o.isTests()))
				.recordName(o.getStruct())
				.metadataKey(tag)
				.metadataKeyCaptureExpression(isBlank(o.getTagRegex()) ? null : o.getTagRegex())
				.namingOptions(namingOptions)
				.style(style.get())
				.includeUnexportedFields(o.isIncludeUnexportedFields())
				.outputTarget(outDir.resolve(outFile).normalize())
				.outputPackage(outputPackage)
				.outputImportPath(outputImportPath(outDir, outputPackage))
				.build();
	}

	/**
	 * Import path of the generated file's package; an external test package
	 * gets its own path even though it shares the directory.
	 */
	private String outputImportPath(Path outDir, String outputPackage) {
		return moduleLocator.importPathOf(outDir)
				.map(path -> outputPackage.endsWith(EXTERNAL_TEST_SUFFIX) ? path + EXTERNAL_TEST_SUFFIX : path)
				.orElse(null);
	}

	private static boolean isBlank(String s) {
		return s == null || s.trim().isEmpty();
	}
}
