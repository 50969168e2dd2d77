package com.precare.risk.repository;

import com.precare.risk.model.Condition;
import com.precare.risk.rdf.RiskKnowledgeBase;
import jakarta.annotation.PostConstruct;
import org.apache.jena.query.*;
import org.apache.jena.system.Txn;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.concurrent.ConcurrentHashMap;

import static com.precare.risk.rdf.RiskKnowledgeBase.PRECARE;
import static com.precare.risk.rdf.RiskKnowledgeBase.SCHEMA;

/**
 * Condition names plus the fixed recommendation and key-factor lists, read from the
 * knowledge base.
 */
@Component
public class ConditionCatalogRepository {

    private final RiskKnowledgeBase rdf;
    private final Map<String, CatalogEntry> entriesMap = new ConcurrentHashMap<>();
    private volatile List<CatalogEntry> cachedEntries = List.of();

    public ConditionCatalogRepository(RiskKnowledgeBase rdf) {
        this.rdf = rdf;
    }

    @PostConstruct
    public void init() {
        refresh();
    }

    public void refresh() {
        List<CatalogEntry> entries = fetchAllFromRdf();
        entriesMap.clear();
        for (CatalogEntry entry : entries) {
            entriesMap.put(entry.identifier(), entry);
        }
        cachedEntries = List.copyOf(entries);
    }

    public record CatalogEntry(
            String identifier,
            String name,
            List<String> recommendations,
            List<String> keyFactors
    ) {}

    public List<CatalogEntry> findAll() {
        return cachedEntries;
    }

    public Optional<CatalogEntry> findById(String id) {
        return Optional.ofNullable(entriesMap.get(id));
    }

    public List<String> recommendationsFor(Condition condition) {
        return require(condition).recommendations();
    }

    public List<String> keyFactorsFor(Condition condition) {
        return require(condition).keyFactors();
    }

    private CatalogEntry require(Condition condition) {
        return findById(condition.id())
                .orElseThrow(() -> new IllegalStateException(
                        "Knowledge base has no entry for condition: " + condition.id()));
    }

    private List<CatalogEntry> fetchAllFromRdf() {
        String conditionsQuery = """
                PREFIX schema: <%s>
                SELECT ?identifier ?name WHERE {
                  ?condition a schema:MedicalCondition ;
                             schema:identifier ?identifier ;
                             schema:name ?name .
                }
                ORDER BY ?identifier
                """.formatted(SCHEMA);

        String recommendationsQuery = """
                PREFIX schema: <%s>
                PREFIX pc: <%s>
                SELECT ?identifier ?text WHERE {
                  ?condition a schema:MedicalCondition ;
                             schema:identifier ?identifier ;
                             pc:recommendation ?item .
                  ?item pc:rank ?rank ;
                        schema:text ?text .
                }
                ORDER BY ?identifier ?rank
                """.formatted(SCHEMA, PRECARE);

        String keyFactorsQuery = """
                PREFIX schema: <%s>
                PREFIX pc: <%s>
                SELECT ?identifier ?factor WHERE {
                  ?condition a schema:MedicalCondition ;
                             schema:identifier ?identifier ;
                             pc:keyFactor ?item .
                  ?item pc:rank ?rank ;
                        schema:name ?factor .
                }
                ORDER BY ?identifier ?rank
                """.formatted(SCHEMA, PRECARE);

        return Txn.calculateRead(rdf.getDataset(), () -> {
            Map<String, String> identifierToNameMap = new LinkedHashMap<>();
            try (QueryExecution queryExecution = QueryExecutionFactory.create(conditionsQuery, rdf.getDataset())) {
                ResultSet resultSet = queryExecution.execSelect();
                while (resultSet.hasNext()) {
                    QuerySolution row = resultSet.next();
                    identifierToNameMap.putIfAbsent(
                            row.getLiteral("identifier").getString(),
                            row.getLiteral("name").getString());
                }
            }

            Map<String, List<String>> recommendations = selectRankedStrings(recommendationsQuery, "text");
            Map<String, List<String>> keyFactors = selectRankedStrings(keyFactorsQuery, "factor");

            List<CatalogEntry> entries = new ArrayList<>();
            for (String identifier : identifierToNameMap.keySet()) {
                entries.add(new CatalogEntry(
                        identifier,
                        identifierToNameMap.get(identifier),
                        List.copyOf(recommendations.getOrDefault(identifier, List.of())),
                        List.copyOf(keyFactors.getOrDefault(identifier, List.of()))
                ));
            }
            return entries;
        });
    }

    private Map<String, List<String>> selectRankedStrings(String sparqlQuery, String varName) {
        Map<String, List<String>> identifierToValues = new LinkedHashMap<>();
        try (QueryExecution queryExecution = QueryExecutionFactory.create(sparqlQuery, rdf.getDataset())) {
            ResultSet resultSet = queryExecution.execSelect();
            while (resultSet.hasNext()) {
                QuerySolution row = resultSet.next();
                identifierToValues
                        .computeIfAbsent(row.getLiteral("identifier").getString(), k -> new ArrayList<>())
                        .add(row.getLiteral(varName).getString());
            }
        }
        return identifierToValues;
    }
}
