/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.episim.centrality;

import io.episim.graph.ContactGraph;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/// Eigen decomposition helpers over the symmetric adjacency matrix of a graph.
final class AdjacencySpectrum {

    /// Scores closer than this are solver noise; snapping them lets the identifier tie
    /// break apply to vertices that are structurally equivalent.
    private static final double RESOLUTION = 1.0e-10d;

    private AdjacencySpectrum() {
    }

    static double[][] adjacencyMatrix(ContactGraph graph) {
        int n = graph.size();
        double[][] matrix = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int k = 0; k < graph.degree(i); k++) {
                matrix[i][graph.neighbor(i, k)] = 1.0d;
            }
        }
        return matrix;
    }

    /// @return the largest eigenvalue, 0 for an empty matrix
    static double largestEigenvalue(double[][] matrix) {
        if (matrix.length == 0) {
            return 0.0d;
        }
        EigenDecomposition decomposition = new EigenDecomposition(new Array2DRowRealMatrix(matrix, false));
        double[] eigenvalues = decomposition.getRealEigenvalues();
        return eigenvalues[indexOfMax(eigenvalues)];
    }

    /// @return the unit eigenvector of the largest eigenvalue, oriented so its components sum to a non-negative value
    static double[] leadingEigenvector(double[][] matrix) {
        if (matrix.length == 0) {
            return new double[0];
        }
        RealMatrix adjacency = new Array2DRowRealMatrix(matrix, false);
        EigenDecomposition decomposition = new EigenDecomposition(adjacency);
        double[] eigenvalues = decomposition.getRealEigenvalues();
        RealVector vector = decomposition.getEigenvector(indexOfMax(eigenvalues));
        double[] components = vector.toArray();
        double sum = 0.0d;
        for (double component : components) {
            sum += component;
        }
        if (sum < 0.0d) {
            for (int i = 0; i < components.length; i++) {
                components[i] = -components[i];
            }
        }
        return components;
    }

    /// Removes row and column `index` from a square matrix.
    static double[][] minor(double[][] matrix, int index) {
        int n = matrix.length;
        double[][] result = new double[n - 1][n - 1];
        for (int i = 0, r = 0; i < n; i++) {
            if (i == index) {
                continue;
            }
            for (int j = 0, c = 0; j < n; j++) {
                if (j == index) {
                    continue;
                }
                result[r][c++] = matrix[i][j];
            }
            r++;
        }
        return result;
    }

    static double snap(double value) {
        double snapped = Math.rint(value / RESOLUTION) * RESOLUTION;
        return snapped == 0.0d ? 0.0d : snapped;
    }

    private static int indexOfMax(double[] values) {
        int best = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[best]) {
                best = i;
            }
        }
        return best;
    }
}
