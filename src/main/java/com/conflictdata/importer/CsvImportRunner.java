package com.conflictdata.importer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.nio.file.Path;

/**
 * Runs a CSV import at startup when launched with {@code --import-csv=<file>}.
 * The option may be repeated; files are imported in order.
 */
@Component
public class CsvImportRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(CsvImportRunner.class);

    static final String OPTION = "import-csv";

    @Autowired
    private ConflictCsvImporter importer;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption(OPTION)) {
            return;
        }
        for (String file : args.getOptionValues(OPTION)) {
            log.info("Importing conflict data from {}", file);
            try {
                importer.importFile(Path.of(file));
            } catch (CsvImportException e) {
                log.error("Import of {} failed: {}", file, e.getMessage());
                throw e;
            }
        }
    }
}
