package io.github.themoah.regdetect.changepoint.clustering;

import io.github.themoah.regdetect.compare.ComparisonMode;
import io.github.themoah.regdetect.compare.DistributionComparator;
import io.github.themoah.regdetect.model.ComparisonVerdict;
import io.github.themoah.regdetect.stats.InsufficientDataException;
import io.github.themoah.regdetect.stats.StatisticalUtils;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Approximation of the E-Divisive change detection algorithm.
 *
 * <p>The most likely split of a range is estimated with a Euclidean energy-distance
 * estimator and confirmed by comparing the two clusters it produces. Randomized
 * permutation testing of each cluster decides whether to keep bisecting, biased
 * towards earlier clusters.
 *
 * <p>Instances are not thread-safe because they share one {@link Random}.
 */
public class ClusteringChangeDetector {

  private static final Logger log = LoggerFactory.getLogger(ClusteringChangeDetector.class);

  static final int MAX_PERMUTATION_ITERATIONS = 150;
  static final double PERMUTATION_DIFFERENT_RATIO = 0.05;
  static final int MIN_SEQUENCE_LENGTH = 3;
  private static final int ESTIMATOR_MARGIN = 1;

  private final Random random;

  public ClusteringChangeDetector() {
    this(new Random());
  }

  public ClusteringChangeDetector(Random random) {
    this.random = random;
  }

  /**
   * Most likely split index of a sequence.
   *
   * @param index index of the first value of the right cluster
   * @param found false when the sequence is too short to split
   */
  public record Estimate(int index, boolean found) {}

  /**
   * Result of comparing the clusters on both sides of a split.
   */
  record ClusterComparison(ComparisonVerdict verdict, double[] left, double[] right) {}

  /**
   * Finds indices where the values shift significantly.
   *
   * @param values values in time-series order
   * @return split indices, each the index of the first value after a shift
   * @throws InsufficientDataException if there are 3 values or fewer, or no split
   *     is significant
   */
  public List<Integer> clusterAndFindSplit(double[] values) {
    log.debug("Starting change point detection on {} values", values.length);
    int length = values.length;
    if (length <= MIN_SEQUENCE_LENGTH) {
      throw new InsufficientDataException(
        "Sequence is not larger than minimum length (" + length + " <= " + MIN_SEQUENCE_LENGTH + ")");
    }

    int start = 0;
    List<Integer> candidates = new ArrayList<>();
    while (true) {
      double[] segment = Arrays.copyOfRange(values, start, start + length);
      int partitionPoint = changePointEstimator(segment).index();
      log.debug("Values for start = {}, length = {}, partition point = {}", start, length, partitionPoint);

      ClusterComparison comparison = clusterAndCompare(segment, partitionPoint);
      if (comparison.verdict() == ComparisonVerdict.DIFFERENT) {
        candidates.add(start + partitionPoint);
      }

      boolean inLeft = false;
      boolean inRight = false;
      if (permutationTest(comparison.left())) {
        log.debug("Left: permutation testing positive at [{}, {})", start, start + partitionPoint);
        inLeft = changePointEstimator(comparison.left()).found();
      }
      if (permutationTest(comparison.right())) {
        log.debug("Right: permutation testing positive at [{}, {})", start + partitionPoint, start + length);
        inRight = changePointEstimator(comparison.right()).found();
      }

      if (!inLeft && !inRight) {
        break;
      }
      if (inLeft) {
        length = Math.min(partitionPoint + 1, length);
      } else {
        start = start + Math.max(partitionPoint, 0);
        length = Math.min(comparison.right().length, length);
      }
    }

    if (candidates.isEmpty()) {
      throw new InsufficientDataException("Not enough data to suggest a change point");
    }
    return candidates;
  }

  /**
   * Estimates the most likely split of a sequence: for each index, the scaled
   * squared distances between the two clusters minus the scaled squared distances
   * within each cluster. The first and last values are never split off.
   *
   * <p>Quadratic in the sequence length.
   */
  public static Estimate changePointEstimator(double[] sequence) {
    int n = sequence.length;
    if (n <= 2 * ESTIMATOR_MARGIN) {
      return new Estimate(0, false);
    }
    int bestIndex = ESTIMATOR_MARGIN;
    double bestEstimate = Double.NEGATIVE_INFINITY;
    for (int index = ESTIMATOR_MARGIN; index < n - ESTIMATOR_MARGIN; index++) {
      double estimate = estimate(sequence, index);
      if (estimate > bestEstimate) {
        bestEstimate = estimate;
        bestIndex = index;
      }
    }
    return new Estimate(bestIndex, true);
  }

  // 2Y/(|A||B|) - X_a/(|A|/2) - X_b/(|B|/2), with ordered pairs within each cluster.
  private static double estimate(double[] sequence, int index) {
    int n = sequence.length;
    double withinLeft = 0.0;
    for (int i = 0; i < index; i++) {
      for (int j = 0; j < index; j++) {
        withinLeft += square(sequence[i] - sequence[j]);
      }
    }
    double withinRight = 0.0;
    for (int i = index; i < n; i++) {
      for (int j = index; j < n; j++) {
        withinRight += square(sequence[i] - sequence[j]);
      }
    }
    double between = 0.0;
    for (int i = 0; i < index; i++) {
      for (int j = index; j < n; j++) {
        between += square(sequence[i] - sequence[j]);
      }
    }
    double leftSize = index;
    double rightSize = n - index;
    return between * 2.0 / (leftSize * rightSize)
      - withinLeft / (leftSize / 2.0)
      - withinRight / (rightSize / 2.0);
  }

  /**
   * Splits a sequence at {@code partitionPoint} (which goes to the right cluster)
   * and compares the two clusters in performance mode. The magnitude is the mean
   * of the two clusters' interquartile ranges when both hold more than two values,
   * else 1.
   */
  static ClusterComparison clusterAndCompare(double[] sequence, int partitionPoint) {
    double[] left = Arrays.copyOfRange(sequence, 0, partitionPoint);
    double[] right = Arrays.copyOfRange(sequence, partitionPoint, sequence.length);
    double magnitude = 1.0;
    if (left.length > 2 && right.length > 2) {
      magnitude = (StatisticalUtils.iqr(left) + StatisticalUtils.iqr(right)) / 2.0;
    }
    int attemptCount = (left.length + right.length) / 2;
    ComparisonVerdict verdict = DistributionComparator
      .compare(left, right, attemptCount, ComparisonMode.PERFORMANCE, magnitude)
      .verdict();
    return new ClusterComparison(verdict, left, right);
  }

  /**
   * Checks whether a sequence may hide a change point: random subsets of half its
   * size are split at their estimated change point, and the test is positive when
   * at least 5% of the splits compare DIFFERENT.
   */
  public boolean permutationTest(double[] sequence) {
    if (sequence.length < MIN_SEQUENCE_LENGTH) {
      return false;
    }
    int sampleSize = (sequence.length - 1) / 2;
    int iterations = permutationIterations(sequence.length);

    int sames = 0;
    int unknowns = 0;
    int differences = 0;
    for (int i = 0; i < iterations; i++) {
      double[] permutation = sample(sequence, sampleSize);
      Estimate estimate = changePointEstimator(permutation);
      if (!estimate.found()) {
        sames++;
        continue;
      }
      switch (clusterAndCompare(permutation, estimate.index()).verdict()) {
        case SAME -> sames++;
        case DIFFERENT -> differences++;
        default -> unknowns++;
      }
    }

    int total = sames + unknowns + differences;
    double probability = total > 0 ? (double) differences / total : 0.0;
    log.debug("Computed probability: {}; sames = {}, differences = {}, unknowns = {}",
      probability, sames, differences, unknowns);
    return probability >= PERMUTATION_DIFFERENT_RATIO;
  }

  // min(150, n!) without overflowing.
  static int permutationIterations(int n) {
    long factorial = 1;
    for (int k = 2; k <= n; k++) {
      factorial *= k;
      if (factorial >= MAX_PERMUTATION_ITERATIONS) {
        return MAX_PERMUTATION_ITERATIONS;
      }
    }
    return (int) factorial;
  }

  // Random subset in random order, drawn without replacement.
  private double[] sample(double[] pool, int size) {
    double[] copy = pool.clone();
    for (int i = 0; i < size; i++) {
      int j = i + random.nextInt(copy.length - i);
      double tmp = copy[i];
      copy[i] = copy[j];
      copy[j] = tmp;
    }
    return Arrays.copyOf(copy, size);
  }

  private static double square(double value) {
    return value * value;
  }
}
