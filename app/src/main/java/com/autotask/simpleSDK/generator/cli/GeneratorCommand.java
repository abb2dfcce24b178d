package com.autotask.simpleSDK.generator.cli;

import com.autotask.simpleSDK.generator.SdkGenerator;
import com.autotask.simpleSDK.generator.catalog.CatalogException;
import com.autotask.simpleSDK.generator.catalog.EntityCatalog;
import picocli.CommandLine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
    name = "autotask-sdk-generator",
    description = "Generate Autotask SDK entity, model and client classes from an entity catalog",
    mixinStandardHelpOptions = true,
    version = "1.0.0-SNAPSHOT"
)
public class GeneratorCommand implements Callable<Integer> {
    private static final Logger logger = LoggerFactory.getLogger(GeneratorCommand.class);

    @CommandLine.Parameters(
        description = "Entities to generate, by plural or record name (default: every catalog entry)",
        arity = "0..*"
    )
    private List<String> entityNames;

    @CommandLine.Option(
        names = {"-c", "--catalog"},
        description = "Entity catalog JSON file (default: bundled entities.json)"
    )
    private Path catalogFile;

    @CommandLine.Option(
        names = {"-o", "--output-dir"},
        description = "Output directory for generated SDK code (default: sdk/src/main/java)",
        defaultValue = "sdk/src/main/java"
    )
    private String outputDirectory;

    @CommandLine.Option(
        names = {"-p", "--package"},
        description = "Base package name for generated code (default: com.autotask.simpleSDK)",
        defaultValue = "com.autotask.simpleSDK"
    )
    private String basePackage;

    @Override
    public Integer call() {
        logger.info("Catalog: {}", catalogFile != null ? catalogFile : EntityCatalog.DEFAULT_RESOURCE);
        logger.info("Output directory: {}", outputDirectory);
        logger.info("Base package: {}", basePackage);

        try {
            EntityCatalog catalog = catalogFile != null ? EntityCatalog.load(catalogFile) : EntityCatalog.loadDefault();
            catalog = catalog.select(entityNames);

            Path outputPath = Paths.get(outputDirectory);
            new SdkGenerator(basePackage).generate(catalog, outputPath);

            logger.info("Generated {} entities", catalog.getEntities().size());
            return 0;
        } catch (CatalogException e) {
            logger.error("Invalid entity catalog: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            logger.error("Error writing generated sources", e);
            return 1;
        }
    }
}
