package com.modtools.idconflict.cli.model;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import lombok.Getter;
import picocli.CommandLine.Option;

/**
 * Raw options of the "scan" command, as picocli filled them in. No validation, no defaults
 * beyond what picocli applies.
 */
@Getter
public class ScanCommandOptions {

	@Option(names = { "--root", "-r" }, required = true, description = "Mods folder to scan")
	private Path root;

	@Option(names = { "--cache" }, description = "Parse cache file (default: ~/.mod-id-conflicts/id_index_cache.json)")
	private Path cacheFile;

	@Option(names = { "--no-cache" }, description = "Neither read nor write the parse cache")
	private boolean noCache;

	@Option(names = { "--inventory" }, description = "Inventory snapshot JSON to use instead of walking the folder")
	private Path inventoryFile;

	@Option(names = { "--no-recursive" }, description = "Only look at packages directly inside the root")
	private boolean noRecursive;

	@Option(names = { "--fast" }, description = "Skip tail scanning of packages with a damaged index")
	private boolean fast;

	@Option(names = { "--workers" }, defaultValue = "0", description = "Parser threads (0 = one per CPU, 2 to 8)")
	private int workers;

	@Option(names = { "--extension",
			"-e" }, description = "Package file extension, repeatable (default: .package)")
	private List<String> extensions = new ArrayList<>();

	@Option(names = { "--report" }, description = "Write a plain-text conflict report to this file")
	private Path reportFile;

	@Option(names = { "--load-order" }, arity = "0..1", fallbackValue = "",
			description = "Write a load-order suggestion JSON to this file (default: load_order_suggestion.json in the mods folder)")
	private Path loadOrderFile;

	@Option(names = { "--installed-mods" }, description = "installed_mods.json to check conflicting mods against")
	private Path installedModsFile;

	@Option(names = { "--latest-patch" }, description = "Release date of the latest game patch (yyyy-MM-dd)")
	private String latestPatch;

	@Option(names = { "--verbose", "-v" }, description = "Log parser details")
	private boolean verbose;
}
