package com.precare.risk.repository;

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
 * Named coefficient bundles ({@code base_risk} plus per-factor weights). Only conditions
 * scored from a coefficient table have a model here.
 */
@Component
public class ConditionModelRegistry {

    private final RiskKnowledgeBase rdf;
    private final Map<String, ConditionModel> modelsMap = new ConcurrentHashMap<>();

    public ConditionModelRegistry(RiskKnowledgeBase rdf) {
        this.rdf = rdf;
    }

    @PostConstruct
    public void init() {
        refresh();
    }

    public void refresh() {
        List<ConditionModel> models = fetchAllFromRdf();
        modelsMap.clear();
        for (ConditionModel model : models) {
            modelsMap.put(model.name(), model);
        }
    }

    public record ConditionModel(
            String name,
            double baseRisk,
            Map<String, Double> weights
    ) {
        public ConditionModel {
            weights = Map.copyOf(weights);
        }

        public double weight(String factor) {
            Double weight = weights.get(factor);
            if (weight == null) {
                throw new IllegalStateException("Model '" + name + "' has no weight named " + factor);
            }
            return weight;
        }
    }

    public Optional<ConditionModel> findByName(String name) {
        return Optional.ofNullable(modelsMap.get(name));
    }

    public ConditionModel require(String name) {
        return findByName(name)
                .orElseThrow(() -> new IllegalStateException("No risk model registered under: " + name));
    }

    private List<ConditionModel> fetchAllFromRdf() {
        String sparqlQuery = """
                PREFIX schema: <%s>
                PREFIX pc: <%s>
                SELECT ?model ?baseRisk ?factor ?value WHERE {
                  ?m a pc:RiskModel ;
                     schema:name ?model ;
                     pc:baseRisk ?baseRisk .
                  OPTIONAL {
                    ?m pc:weight ?w .
                    ?w schema:name ?factor ;
                       pc:value ?value .
                  }
                }
                ORDER BY ?model ?factor
                """.formatted(SCHEMA, PRECARE);

        return Txn.calculateRead(rdf.getDataset(), () -> {
            Map<String, Double> modelToBaseRisk = new LinkedHashMap<>();
            Map<String, Map<String, Double>> modelToWeights = new LinkedHashMap<>();

            try (QueryExecution queryExecution = QueryExecutionFactory.create(sparqlQuery, rdf.getDataset())) {
                ResultSet resultSet = queryExecution.execSelect();
                while (resultSet.hasNext()) {
                    QuerySolution row = resultSet.next();
                    String model = row.getLiteral("model").getString();
                    modelToBaseRisk.putIfAbsent(model, row.getLiteral("baseRisk").getDouble());
                    Map<String, Double> weights = modelToWeights.computeIfAbsent(model, k -> new LinkedHashMap<>());
                    if (row.contains("factor")) {
                        weights.put(row.getLiteral("factor").getString(), row.getLiteral("value").getDouble());
                    }
                }
            }

            List<ConditionModel> models = new ArrayList<>();
            for (String model : modelToBaseRisk.keySet()) {
                models.add(new ConditionModel(model, modelToBaseRisk.get(model), modelToWeights.get(model)));
            }
            return models;
        });
    }
}
