package com.modtools.idconflict.cli.validation;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

import com.modtools.idconflict.cli.exception.OptionsValidationException;
import com.modtools.idconflict.cli.model.ScanCommandOptions;
import com.modtools.idconflict.cli.model.ValidatedScanOptions;
import com.modtools.idconflict.report.LoadOrderSuggester;
import com.modtools.idconflict.scan.ScanOptions;

public class ScanOptionsValidator {

	public static final int MAX_WORKERS = 64;

	private final Path defaultCacheFile;

	public ScanOptionsValidator() {
		this(Path.of(System.getProperty("user.home"), ".mod-id-conflicts", "id_index_cache.json"));
	}

	public ScanOptionsValidator(Path defaultCacheFile) {
		this.defaultCacheFile = defaultCacheFile;
	}

	public ValidatedScanOptions validate(ScanCommandOptions o) {
		List<String> errors = new ArrayList<>();

		Path root = null;
		if (o.getRoot() == null) {
			errors.add("Mods folder is required (--root / -r).");
		} else if (!Files.isDirectory(o.getRoot())) {
			errors.add("Mods folder does not exist or is not a directory: " + o.getRoot());
		} else {
			root = o.getRoot().toAbsolutePath().normalize();
		}

		if (o.isNoCache() && o.getCacheFile() != null) {
			errors.add("--cache and --no-cache cannot be used together.");
		}
		Path cacheFile = null;
		if (!o.isNoCache()) {
			cacheFile = (o.getCacheFile() != null ? o.getCacheFile() : defaultCacheFile).toAbsolutePath().normalize();
			if (Files.isDirectory(cacheFile)) {
				errors.add("Cache file is a directory: " + cacheFile);
			}
		}

		Path inventoryFile = null;
		if (o.getInventoryFile() != null) {
			if (!Files.isRegularFile(o.getInventoryFile())) {
				errors.add("Inventory snapshot does not exist or is not a file: " + o.getInventoryFile());
			} else {
				inventoryFile = o.getInventoryFile().toAbsolutePath().normalize();
			}
		}

		if (o.getWorkers() < 0 || o.getWorkers() > MAX_WORKERS) {
			errors.add("Worker count must be in range 0-" + MAX_WORKERS + ". Got: " + o.getWorkers());
		}

		Set<String> extensions = parseExtensions(o.getExtensions(), errors);

		Path reportFile = outputFile(o.getReportFile(), "Report", errors);
		Path loadOrderFile = outputFile(loadOrderTarget(o.getLoadOrderFile(), root), "Load-order", errors);
		if (reportFile != null && reportFile.equals(loadOrderFile)) {
			errors.add("--report and --load-order must name different files: " + reportFile);
		}

		Path installedModsFile = null;
		if (o.getInstalledModsFile() != null) {
			if (!Files.isRegularFile(o.getInstalledModsFile())) {
				errors.add("Installed mods file does not exist or is not a file: " + o.getInstalledModsFile());
			} else {
				installedModsFile = o.getInstalledModsFile().toAbsolutePath().normalize();
			}
		}

		LocalDate latestPatch = null;
		if (o.getLatestPatch() != null) {
			try {
				latestPatch = LocalDate.parse(o.getLatestPatch().trim());
			} catch (DateTimeParseException e) {
				errors.add("Latest patch date must be yyyy-MM-dd. Got: " + o.getLatestPatch());
			}
			if (o.getInstalledModsFile() == null) {
				errors.add("--latest-patch requires --installed-mods.");
			}
		}

		if (!errors.isEmpty()) {
			throw new OptionsValidationException(errors);
		}

		ScanOptions scanOptions = ScanOptions.builder()
				.recursive(!o.isNoRecursive())
				.useInventory(inventoryFile != null)
				.fastMode(o.isFast())
				.extensions(extensions)
				.workerCount(o.getWorkers())
				.build();

		return new ValidatedScanOptions(root, scanOptions, cacheFile, inventoryFile, reportFile, loadOrderFile,
				installedModsFile, latestPatch);
	}

	private static Set<String> parseExtensions(List<String> raw, List<String> errors) {
		if (raw == null || raw.isEmpty()) {
			return Set.of(".package");
		}
		Set<String> result = new LinkedHashSet<>();
		for (String ext : raw) {
			String trimmed = ext == null ? "" : ext.trim();
			if (trimmed.isEmpty() || trimmed.equals(".")) {
				errors.add("Extension must not be blank.");
			} else if (trimmed.contains("/") || trimmed.contains("\\")) {
				errors.add("Extension must not contain a path separator: " + trimmed);
			} else {
				String normalized = trimmed.startsWith(".") ? trimmed : "." + trimmed;
				result.add(normalized.toLowerCase(Locale.ROOT));
			}
		}
		return result;
	}

	/**
	 * "--load-order" given without a file name writes into the mods folder.
	 */
	private static Path loadOrderTarget(Path p, Path root) {
		if (p == null || !p.toString().isEmpty()) {
			return p;
		}
		return root != null ? root.resolve(LoadOrderSuggester.DEFAULT_FILE_NAME) : null;
	}

	private static Path outputFile(Path p, String what, List<String> errors) {
		if (p == null) {
			return null;
		}
		Path normalized = p.toAbsolutePath().normalize();
		if (Files.isDirectory(normalized)) {
			errors.add(what + " target is a directory: " + normalized);
		}
		return normalized;
	}
}
