package org.phylo.beastxml.bind;

import org.phylo.beastxml.iqtree.IqTreeScheme;
import org.phylo.beastxml.iqtree.PartitionSlicer;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a {@link BindingContext} from a JSON manifest.
 *
 * <pre>
 * {
 *   "partitions": [{"name": "gene1", "length": 300, "dataType": "nucleotide", "model": "HKY+G4"}],
 *   "traits":     [{"name": "location", "kind": "discrete"}],
 *   "taxa": [{
 *     "id": "A/2019", "date": "2019-04-02",
 *     "sequences": {"gene1": "ACGT..."},
 *     "attributes": {"location": "UK"}
 *   }]
 * }
 * </pre>
 *
 * With an IQ-TREE scheme, partitions come from the scheme instead, and a taxon
 * may give one full-length {@code "sequence"} that is sliced per partition.
 * Dates are decimal years (number or string) or {@code YYYY-MM-DD}.
 */
public final class BindingContextReader {

    private BindingContextReader() {
        // Static utility class
    }

    public static BindingContext read(Path manifest, IqTreeScheme scheme) throws IOException {
        return parse(Files.readString(manifest, StandardCharsets.UTF_8), scheme);
    }

    public static BindingContext parse(String json) {
        return parse(json, null);
    }

    /**
     * @param scheme Optional IQ-TREE scheme supplying partitions and models
     * @throws ManifestException if the manifest is malformed or inconsistent
     */
    public static BindingContext parse(String json, IqTreeScheme scheme) {
        Map<String, Object> root = ManifestJson.asObject(ManifestJson.parse(json), "manifest");

        List<PartitionBinding> partitions = scheme == null ? readPartitions(root) : schemePartitions(root, scheme);
        List<TraitBinding> traits = readTraits(root);
        List<TaxonBinding> taxa = new ArrayList<>();
        List<Object> entries = ManifestJson.getList(root, "taxa", "manifest");
        for (int i = 0; i < entries.size(); i++) {
            taxa.add(readTaxon(ManifestJson.asObject(entries.get(i), "taxa[" + i + "]"), "taxa[" + i + "]", scheme));
        }

        try {
            return new BindingContext(partitions, taxa, traits);
        } catch (IllegalArgumentException e) {
            throw new ManifestException(e.getMessage(), e);
        }
    }

    private static List<PartitionBinding> readPartitions(Map<String, Object> root) {
        List<PartitionBinding> partitions = new ArrayList<>();
        List<Object> entries = ManifestJson.getList(root, "partitions", "manifest");
        for (int i = 0; i < entries.size(); i++) {
            String where = "partitions[" + i + "]";
            Map<String, Object> entry = ManifestJson.asObject(entries.get(i), where);
            Object length = entry.get("length");
            if (!(length instanceof Long)) {
                throw new ManifestException(where + ".length must be an integer");
            }
            try {
                partitions.add(new PartitionBinding(
                        ManifestJson.requireString(entry, "name", where),
                        Math.toIntExact((Long) length),
                        ManifestJson.getString(entry, "dataType", where),
                        ManifestJson.getString(entry, "model", where)));
            } catch (IllegalArgumentException | ArithmeticException e) {
                throw new ManifestException(where + ": " + e.getMessage(), e);
            }
        }
        return partitions;
    }

    private static List<PartitionBinding> schemePartitions(Map<String, Object> root, IqTreeScheme scheme) {
        if (root.containsKey("partitions")) {
            throw new ManifestException("Manifest lists partitions but an IQ-TREE scheme was also given");
        }
        List<PartitionBinding> partitions = new ArrayList<>();
        for (String name : scheme.partitionNames()) {
            partitions.add(new PartitionBinding(name, scheme.columns(name).size(), PartitionBinding.NUCLEOTIDE,
                    scheme.modelNames().get(name)));
        }
        return partitions;
    }

    private static List<TraitBinding> readTraits(Map<String, Object> root) {
        List<TraitBinding> traits = new ArrayList<>();
        List<Object> entries = ManifestJson.getList(root, "traits", "manifest");
        for (int i = 0; i < entries.size(); i++) {
            String where = "traits[" + i + "]";
            Map<String, Object> entry = ManifestJson.asObject(entries.get(i), where);
            String kind = ManifestJson.getString(entry, "kind", where);
            try {
                traits.add(new TraitBinding(ManifestJson.requireString(entry, "name", where),
                        kind == null ? TraitKind.DISCRETE : TraitKind.valueOf(kind.toUpperCase(Locale.ROOT))));
            } catch (IllegalArgumentException e) {
                throw new ManifestException(where + ".kind must be 'discrete' or 'continuous', got " + kind, e);
            }
        }
        return traits;
    }

    private static TaxonBinding readTaxon(Map<String, Object> entry, String where, IqTreeScheme scheme) {
        String id = ManifestJson.requireString(entry, "id", where);

        Map<String, String> sequences = new LinkedHashMap<>();
        ManifestJson.getObject(entry, "sequences", where).forEach((partition, sequence) -> {
            if (!(sequence instanceof String)) {
                throw new ManifestException(where + ".sequences." + partition + " must be a string");
            }
            sequences.put(partition, (String) sequence);
        });
        String full = ManifestJson.getString(entry, "sequence", where);
        if (full != null) {
            if (scheme == null) {
                throw new ManifestException(where + ".sequence needs an IQ-TREE scheme to be sliced");
            }
            for (String partition : scheme.partitionNames()) {
                try {
                    sequences.putIfAbsent(partition, PartitionSlicer.slice(full, scheme.columns(partition)));
                } catch (IllegalArgumentException e) {
                    throw new ManifestException(where + ".sequence: " + e.getMessage(), e);
                }
            }
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        ManifestJson.getObject(entry, "attributes", where).forEach((name, value) -> {
            if (value == null || value instanceof Map || value instanceof List) {
                throw new ManifestException(where + ".attributes." + name + " must be a scalar");
            }
            attributes.put(name, value.toString());
        });

        return new TaxonBinding(id, readDate(entry.get("date"), where), sequences, attributes);
    }

    private static Double readDate(Object value, String where) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        if (value instanceof String text) {
            try {
                return DecimalYear.parse(text);
            } catch (IllegalArgumentException e) {
                throw new ManifestException(where + ".date: " + e.getMessage(), e);
            }
        }
        throw new ManifestException(where + ".date must be a number or a string");
    }
}
