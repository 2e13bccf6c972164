package com.dbmodel.converter.codegen;

import com.dbmodel.converter.codegen.context.SynthesisStats;
import com.dbmodel.converter.codegen.dbm.DbmModelSynthesizer;
import com.dbmodel.converter.codegen.dbm.SynthesisResult;
import com.dbmodel.converter.codegen.merge.DbmMerger;
import com.dbmodel.converter.codegen.util.OutputFileWriter;
import com.dbmodel.converter.exception.ConversionException;
import com.dbmodel.converter.model.SchemaGraph;
import com.dbmodel.converter.parser.SchemaGraphReader;
import com.dbmodel.converter.parser.WorkbenchDocumentLoader;
import com.dbmodel.converter.xml.XmlSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs one conversion: load the workbench archive, build the schema graph, synthesize the
 * destination model, merge auxiliary documents and write the result.
 */
public class ConversionService {
    private static final Logger log = LoggerFactory.getLogger(ConversionService.class);

    private final ConverterConfig config;

    private final WorkbenchDocumentLoader documentLoader = new WorkbenchDocumentLoader();
    private final DbmMerger merger = new DbmMerger();

    public ConversionService(ConverterConfig config) {
        this.config = config;
    }

    public ConversionResult convert() {
        try {
            log.info("Starting conversion of {}", config.getSourcePath());

            log.info("Step 1: Loading workbench document...");
            Element physicalModel = documentLoader.loadPhysicalModel(config.getSourcePath());

            log.info("Step 2: Building schema graph...");
            SchemaGraph graph = new SchemaGraphReader().build(physicalModel);

            log.info("Step 3: Synthesizing destination model...");
            SynthesisResult synthesis = new DbmModelSynthesizer(config).synthesize(graph);

            int merged = 0;
            if (!config.getMergePaths().isEmpty()) {
                log.info("Step 4: Merging auxiliary models...");
                for (Path mergePath : config.getMergePaths()) {
                    merged += merger.merge(synthesis.getDocument(), mergePath);
                }
            }

            Path outputPath = config.getOutputPath();
            log.info("Saving converted file as {}", outputPath);
            OutputFileWriter.writeAtomically(outputPath, XmlSupport.serialize(synthesis.getDocument()));

            SynthesisStats stats = synthesis.getStats();
            return ConversionResult.builder()
                    .success(true)
                    .outputPath(outputPath)
                    .tablesConverted(stats.getTableCount())
                    .columnsConverted(stats.getColumnCount())
                    .relationshipsCreated(stats.getRelationshipCount())
                    .indexesCreated(stats.getIndexCount())
                    .domainsCreated(stats.getDomainCount())
                    .enumsCreated(stats.getEnumCount())
                    .triggersCreated(stats.getTriggerCount())
                    .mergedObjects(merged)
                    .warningCount(synthesis.getDiagnostics().getWarnings().size())
                    .build();

        } catch (ConversionException e) {
            log.error("Conversion failed: {}", e.getMessage());
            return ConversionResult.failure(e.getMessage());
        } catch (IOException e) {
            log.error("Conversion failed", e);
            return ConversionResult.failure("I/O error: " + e.getMessage());
        }
    }
}
