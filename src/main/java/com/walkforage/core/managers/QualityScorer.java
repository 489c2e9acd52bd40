package com.walkforage.core.managers;

import com.walkforage.core.domain.crafting.Craftable;
import com.walkforage.core.domain.crafting.QualityTier;
import com.walkforage.core.domain.inventory.Selection;
import com.walkforage.core.domain.resources.Material;
import com.walkforage.core.domain.resources.MaterialCatalog;
import com.walkforage.core.domain.resources.PropertyDefinition;
import com.walkforage.core.domain.resources.ResourceType;
import com.walkforage.core.domain.resources.ResourceTypeRegistry;
import com.walkforage.core.infrastructure.CoreConfig;

import java.util.*;

/**
 * Turns the materials spent on a craftable into a quality score in [0,1] and a tier.
 *
 * Each filled slot (resource type) contributes sum(weight[axis] * normalized[axis]);
 * the score is the mean over filled slots. A slot filled with several materials uses the
 * quantity-weighted mean of their properties. Pure: same inputs, same output.
 */
public class QualityScorer {

    public static final double DEFAULT_FLOOR = 0.1;
    public static final double[] DEFAULT_CUT_POINTS = {0.2, 0.4, 0.6, 0.8};

    private final ResourceTypeRegistry registry;
    private final MaterialCatalog catalog;
    private final double floor;
    private final double[] cutPoints;

    public QualityScorer(ResourceTypeRegistry registry, MaterialCatalog catalog) {
        this(registry, catalog, DEFAULT_FLOOR, DEFAULT_CUT_POINTS);
    }

    /**
     * @param cutPoints minimum score of ADEQUATE, GOOD, EXCELLENT and MASTERWORK, strictly increasing in (0,1]
     */
    public QualityScorer(ResourceTypeRegistry registry, MaterialCatalog catalog, double floor, double[] cutPoints) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        if (!(floor >= 0.0 && floor <= 1.0)) throw new IllegalArgumentException("floor out of [0,1]: " + floor);
        if (!isValidLadder(cutPoints)) {
            throw new IllegalArgumentException("invalid tier cut points: " + Arrays.toString(cutPoints));
        }
        this.floor = floor;
        this.cutPoints = cutPoints.clone();
    }

    public static QualityScorer fromConfig(ResourceTypeRegistry registry, MaterialCatalog catalog) {
        double floor = CoreConfig.getDouble("quality.floor", DEFAULT_FLOOR);
        if (!(floor >= 0.0 && floor <= 1.0)) {
            System.err.println("⚠️ [QualityScorer] quality.floor out of range, using " + DEFAULT_FLOOR);
            floor = DEFAULT_FLOOR;
        }

        double[] ladder = {
                CoreConfig.getDouble("quality.tier.adequate", DEFAULT_CUT_POINTS[0]),
                CoreConfig.getDouble("quality.tier.good", DEFAULT_CUT_POINTS[1]),
                CoreConfig.getDouble("quality.tier.excellent", DEFAULT_CUT_POINTS[2]),
                CoreConfig.getDouble("quality.tier.masterwork", DEFAULT_CUT_POINTS[3])
        };
        if (!isValidLadder(ladder)) {
            System.err.println("⚠️ [QualityScorer] quality.tier.* not strictly increasing, using defaults");
            ladder = DEFAULT_CUT_POINTS;
        }
        return new QualityScorer(registry, catalog, floor, ladder);
    }

    public double getFloor() {
        return floor;
    }

    // ==========================================================
    // SCORE
    // ==========================================================

    public double score(Craftable craftable, Selection usedMaterials) {
        if (craftable == null || usedMaterials == null) return floor;

        double total = 0.0;
        int slots = 0;

        for (String type : usedMaterials.getResourceTypes()) {
            Double slot = slotScore(craftable, type, usedMaterials.aggregate(type));
            if (slot == null) continue;
            total += slot;
            slots++;
        }

        if (slots == 0) return floor;
        return clamp01(total / slots);
    }

    public QualityTier tier(double score) {
        if (Double.isNaN(score)) return QualityTier.POOR;
        QualityTier[] tiers = QualityTier.values();
        for (int i = cutPoints.length - 1; i >= 0; i--) {
            if (score >= cutPoints[i]) return tiers[i + 1];
        }
        return QualityTier.POOR;
    }

    /**
     * Slot score a single material would give this craftable; 0 for unknown types/materials.
     * Used to sort candidate materials in the crafting UI.
     */
    public double materialScore(Craftable craftable, String resourceType, String materialId) {
        if (craftable == null || materialId == null) return 0.0;
        Double s = slotScore(craftable, resourceType, Map.of(materialId, 1L));
        return (s != null) ? s : 0.0;
    }

    /**
     * Candidate materials, best first; ties broken by id so the order is stable.
     */
    public List<String> rankMaterials(Craftable craftable, String resourceType, Collection<String> materialIds) {
        if (materialIds == null || materialIds.isEmpty()) return List.of();
        List<String> out = new ArrayList<>(new LinkedHashSet<>(materialIds));
        Map<String, Double> scores = new HashMap<>();
        for (String id : out) scores.put(id, materialScore(craftable, resourceType, id));

        out.sort(Comparator.<String>comparingDouble(scores::get).reversed().thenComparing(Comparator.naturalOrder()));
        return out;
    }

    // --- HELPER ---

    /**
     * @return null when the slot has no known material (it is then not counted)
     */
    private Double slotScore(Craftable craftable, String resourceType, Map<String, Long> quantities) {
        ResourceType type = registry.get(resourceType);
        if (type == null) return null;

        List<Material> used = new ArrayList<>();
        List<Long> weightsByQty = new ArrayList<>();
        long totalQty = 0;
        for (var e : quantities.entrySet()) {
            if (e.getValue() == null || e.getValue() <= 0) continue;
            Material m = catalog.get(resourceType, e.getKey());
            if (m == null) continue;
            used.add(m);
            weightsByQty.add(e.getValue());
            totalQty += e.getValue();
        }
        if (used.isEmpty()) return null;

        Map<String, Double> weights = craftable.qualityWeights().forType(resourceType, type.defaultQualityWeights());

        double sum = 0.0;
        for (PropertyDefinition prop : type.propertySchema()) {
            double w = weights.getOrDefault(prop.id(), 0.0);
            if (w == 0.0) continue;

            double mean = 0.0;
            for (int i = 0; i < used.size(); i++) {
                Double v = used.get(i).getProperty(prop.id());
                double value = (v != null) ? v : prop.minValue();
                mean += value * weightsByQty.get(i);
            }
            mean /= totalQty;

            sum += w * clamp01(prop.normalize(mean));
        }
        return sum;
    }

    private static double clamp01(double v) {
        if (Double.isNaN(v)) return 0.0;
        return Math.min(1.0, Math.max(0.0, v));
    }

    private static boolean isValidLadder(double[] cut) {
        if (cut == null || cut.length != QualityTier.values().length - 1) return false;
        double prev = 0.0;
        for (double c : cut) {
            if (!(c > prev) || c > 1.0) return false;
            prev = c;
        }
        return true;
    }
}
