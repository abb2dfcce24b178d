package com.autotask.simpleSDK.generator;

import com.autotask.simpleSDK.generator.catalog.CatalogException;
import com.autotask.simpleSDK.generator.catalog.EntityCatalog;
import com.autotask.simpleSDK.generator.catalog.EntityDefinition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Generates the model, entity and client sources for every entity of a catalog.
 *
 * <p>Packages are derived from the base package: {@code <base>.models}, {@code <base>.entities} and
 * {@code <base>.client}.
 */
public class SdkGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SdkGenerator.class);

    private final ModelGenerator modelGenerator;
    private final EntityClassGenerator entityClassGenerator;
    private final ClientGenerator clientGenerator;

    public SdkGenerator(String basePackage) {
        String modelsPackage = basePackage + ".models";
        String entitiesPackage = basePackage + ".entities";
        this.modelGenerator = new ModelGenerator(modelsPackage);
        this.entityClassGenerator = new EntityClassGenerator(entitiesPackage, modelsPackage);
        this.clientGenerator = new ClientGenerator(basePackage + ".client", entitiesPackage);
    }

    /**
     * @return the files written, models and entities first, client last
     */
    public List<Path> generate(EntityCatalog catalog, Path outputRoot) throws IOException, CatalogException {
        List<Path> written = new ArrayList<>();
        for (EntityDefinition entity : catalog.getEntities()) {
            logger.info("Generating {} ({}) with operations {}", entity.pluralName(), entity.name(), entity.operations());
            written.add(modelGenerator.write(entity, outputRoot));
            written.add(entityClassGenerator.write(entity, outputRoot));
        }
        written.add(clientGenerator.write(catalog, outputRoot));
        logger.info("Wrote {} source files under {}", written.size(), outputRoot);
        return written;
    }
}
