package com.precare.risk.rdf;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import org.apache.jena.query.Dataset;
import org.apache.jena.query.DatasetFactory;
import org.apache.jena.riot.Lang;
import org.apache.jena.riot.RDFDataMgr;
import org.apache.jena.system.Txn;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Service;

import java.io.InputStream;

/**
 * Turtle knowledge base holding the condition catalog, the fixed recommendation and key-factor
 * lists and the named coefficient models.
 */
@Service
public class RiskKnowledgeBase {

    private static final Logger log = LoggerFactory.getLogger(RiskKnowledgeBase.class);

    public static final String SCHEMA = "https://schema.org/";
    public static final String PRECARE = "https://precare.example/ontology#";

    private final Resource rdfFile;

    // Dataset (instead of plain Model) lets us use safe read/write transactions.
    @Getter
    private final Dataset dataset = DatasetFactory.createTxnMem();

    public RiskKnowledgeBase(@Value("${precare.rdf.data-file}") Resource rdfFile) {
        this.rdfFile = rdfFile;
    }

    @PostConstruct
    public void load() {
        try (InputStream in = rdfFile.getInputStream()) {
            Txn.executeWrite(dataset, () -> {
                dataset.getDefaultModel().removeAll();
                RDFDataMgr.read(dataset.getDefaultModel(), in, Lang.TURTLE);
            });
        } catch (Exception e) {
            throw new IllegalStateException("Failed to load risk knowledge base: " + rdfFile, e);
        }
        log.info("Loaded risk knowledge base from {} ({} triples)", rdfFile.getDescription(),
                Txn.calculateRead(dataset, () -> dataset.getDefaultModel().size()));
    }
}
