package com.earlywarning.analyzer.model;

import com.earlywarning.analyzer.feature.FeatureSchema;
import com.earlywarning.analyzer.feature.UrlFeatures;

import java.util.List;

/**
 * Random forest: the mean of each tree's leaf probability.
 *
 * <p>
 * Trees are validated on construction (indices in range, children after their
 * parent) so that traversal always terminates.
 * </p>
 *
 * @author Naveed Gung
 */
public final class ForestThreatModel implements ThreatModel {

    private final FeatureSchema schema;
    private final List<CompiledTree> trees;

    public ForestThreatModel(FeatureSchema schema, List<ModelArtifact.Tree> trees) {
        if (trees == null || trees.isEmpty()) {
            throw new IllegalArgumentException("Forest model has no trees");
        }
        this.schema = schema;
        this.trees = trees.stream().map(t -> CompiledTree.compile(t, schema.size())).toList();
    }

    @Override
    public double predict(UrlFeatures features) {
        double[] x = schema.vectorize(features);
        double sum = 0.0;
        for (CompiledTree tree : trees) {
            sum += tree.evaluate(x);
        }
        return sum / trees.size();
    }

    @Override
    public String name() {
        return "forest-" + trees.size() + "-v" + schema.getVersion();
    }

    /** Array-backed tree; {@code feature[i] < 0} marks a leaf. */
    private record CompiledTree(int[] feature, double[] threshold, int[] left, int[] right, double[] probability) {

        static CompiledTree compile(ModelArtifact.Tree tree, int featureCount) {
            if (tree == null || tree.nodes() == null || tree.nodes().isEmpty()) {
                throw new IllegalArgumentException("Tree has no nodes");
            }
            List<ModelArtifact.Node> nodes = tree.nodes();
            int n = nodes.size();
            int[] feature = new int[n];
            double[] threshold = new double[n];
            int[] left = new int[n];
            int[] right = new int[n];
            double[] probability = new double[n];

            for (int i = 0; i < n; i++) {
                ModelArtifact.Node node = nodes.get(i);
                if (node.isLeaf()) {
                    if (node.probability() == null) {
                        throw new IllegalArgumentException("Leaf node " + i + " has no probability");
                    }
                    feature[i] = -1;
                    probability[i] = node.probability();
                    continue;
                }
                if (node.feature() < 0 || node.feature() >= featureCount) {
                    throw new IllegalArgumentException("Node " + i + " references feature " + node.feature());
                }
                if (node.threshold() == null || node.left() == null || node.right() == null) {
                    throw new IllegalArgumentException("Split node " + i + " is incomplete");
                }
                if (node.left() <= i || node.left() >= n || node.right() <= i || node.right() >= n) {
                    throw new IllegalArgumentException("Node " + i + " has out-of-order children");
                }
                feature[i] = node.feature();
                threshold[i] = node.threshold();
                left[i] = node.left();
                right[i] = node.right();
            }
            return new CompiledTree(feature, threshold, left, right, probability);
        }

        double evaluate(double[] x) {
            int i = 0;
            while (feature[i] >= 0) {
                i = x[feature[i]] <= threshold[i] ? left[i] : right[i];
            }
            return probability[i];
        }
    }
}
