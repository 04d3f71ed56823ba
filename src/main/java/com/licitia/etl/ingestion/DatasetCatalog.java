package com.licitia.etl.ingestion;

import com.licitia.etl.domain.enums.Frequency;
import com.licitia.etl.exception.UnknownDatasetException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Static catalog of the sources the extract commands know how to produce.
 */
@Component
public class DatasetCatalog {

    private static final String DEFAULT_NATURAL_ID = "id";

    private final Map<String, DatasetDefinition> definitions = new LinkedHashMap<>();

    public DatasetCatalog() {
        this(List.of(
                new DatasetDefinition("nacional",
                        List.of("licitaciones", "agregacion_ccaa", "contratos_menores",
                                "encargos_medios_propios", "consultas_preliminares"),
                        Frequency.MONTHLY, true, DEFAULT_NATURAL_ID, Map.of()),
                new DatasetDefinition("catalunya",
                        List.of("contratacion_registro", "subvenciones_raisc", "convenios",
                                "presupuestos_aprobados", "rrhh_altos_cargos"),
                        Frequency.QUARTERLY, false, DEFAULT_NATURAL_ID, Map.of()),
                new DatasetDefinition("valencia",
                        List.of("contratacion", "subvenciones", "presupuestos", "convenios", "empleo",
                                "paro", "lobbies", "siniestralidad", "patrimonio", "entidades",
                                "territorio", "turismo", "sanidad", "transporte"),
                        Frequency.MONTHLY, false, DEFAULT_NATURAL_ID, Map.of()),
                new DatasetDefinition("andalucia",
                        List.of("licitaciones", "menores"),
                        Frequency.QUARTERLY, false, "id_expediente", Map.of()),
                new DatasetDefinition("euskadi",
                        List.of("contratos_master", "poderes_adjudicadores", "empresas_licitadoras",
                                "revascon_historico", "bilbao_contratos", "ultimos_90d"),
                        Frequency.QUARTERLY, false, DEFAULT_NATURAL_ID, Map.of()),
                new DatasetDefinition("madrid",
                        List.of("comunidad", "ayuntamiento"),
                        Frequency.ANNUAL, false, DEFAULT_NATURAL_ID, Map.of("comunidad", Frequency.QUARTERLY)),
                new DatasetDefinition("ted",
                        List.of("ted_es_can"),
                        Frequency.QUARTERLY, true, DEFAULT_NATURAL_ID, Map.of())
        ));
    }

    public DatasetCatalog(Collection<DatasetDefinition> definitions) {
        for (DatasetDefinition d : definitions) {
            this.definitions.put(d.name(), d);
        }
    }

    public Optional<DatasetDefinition> find(String dataset) {
        return Optional.ofNullable(dataset == null ? null : definitions.get(dataset));
    }

    /**
     * @throws UnknownDatasetException if the dataset or the subset is not in the catalog
     */
    public DatasetDefinition require(String dataset, String subset) {
        DatasetDefinition definition = find(dataset)
                .orElseThrow(() -> new UnknownDatasetException(dataset, subset));
        if (!definition.hasSubset(subset)) {
            throw new UnknownDatasetException(dataset, subset);
        }
        return definition;
    }

    public List<DatasetSubset> pairs() {
        List<DatasetSubset> out = new ArrayList<>();
        for (DatasetDefinition d : definitions.values()) {
            for (String subset : d.subsets()) {
                out.add(new DatasetSubset(d.name(), subset, d.frequencyFor(subset)));
            }
        }
        return out;
    }

    public record DatasetSubset(String dataset, String subset, Frequency defaultFrequency) {
    }
}
