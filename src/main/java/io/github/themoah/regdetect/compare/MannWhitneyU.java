package io.github.themoah.regdetect.compare;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.apache.commons.math3.distribution.NormalDistribution;

/**
 * Mann-Whitney U rank-sum test over any ordered values, using the normal
 * approximation with tie and continuity corrections.
 *
 * <p>The p-value is one-sided: it measures how unusual the larger of the two
 * U statistics is, so it does not depend on which sample is passed first.
 */
public final class MannWhitneyU {

  private static final NormalDistribution STANDARD_NORMAL = new NormalDistribution(0.0, 1.0);

  private MannWhitneyU() {}

  /**
   * The larger of the two U statistics.
   *
   * @throws IllegalArgumentException if either sample is empty
   */
  public static <T extends Comparable<? super T>> double statistic(List<T> a, List<T> b) {
    if (a.isEmpty() || b.isEmpty()) {
      throw new IllegalArgumentException("Both samples must be non-empty");
    }
    double[] ranks = ranks(a, b).ranks;
    double rankSumA = 0.0;
    for (int i = 0; i < a.size(); i++) {
      rankSumA += ranks[i];
    }
    double na = a.size();
    double nb = b.size();
    double uA = rankSumA - na * (na + 1) / 2.0;
    double uB = na * nb - uA;
    return Math.max(uA, uB);
  }

  /**
   * One-sided p-value of the larger U statistic.
   *
   * @throws IllegalArgumentException if either sample is empty
   */
  public static <T extends Comparable<? super T>> double pValue(List<T> a, List<T> b) {
    if (a.isEmpty() || b.isEmpty()) {
      throw new IllegalArgumentException("Both samples must be non-empty");
    }
    Ranking ranking = ranks(a, b);
    double na = a.size();
    double nb = b.size();
    double total = na + nb;

    double tieCorrection = 1.0;
    if (total > 1) {
      tieCorrection = 1.0 - ranking.tieSum / (total * total * total - total);
    }
    double sd = Math.sqrt(tieCorrection * na * nb * (total + 1) / 12.0);
    if (sd == 0.0) {
      return 1.0;
    }

    double rankSumA = 0.0;
    for (int i = 0; i < a.size(); i++) {
      rankSumA += ranking.ranks[i];
    }
    double uA = rankSumA - na * (na + 1) / 2.0;
    double bigU = Math.max(uA, na * nb - uA);
    double z = (bigU - 0.5 - na * nb / 2.0) / sd;
    double p = 1.0 - STANDARD_NORMAL.cumulativeProbability(z);
    return Math.max(0.0, Math.min(1.0, p));
  }

  // Average ranks over the pooled samples; ranks[0, |a|) belong to a.
  private static <T extends Comparable<? super T>> Ranking ranks(List<T> a, List<T> b) {
    List<T> pooled = new ArrayList<>(a.size() + b.size());
    pooled.addAll(a);
    pooled.addAll(b);
    Integer[] order = new Integer[pooled.size()];
    for (int i = 0; i < order.length; i++) {
      order[i] = i;
    }
    Arrays.sort(order, (x, y) -> pooled.get(x).compareTo(pooled.get(y)));

    double[] ranks = new double[pooled.size()];
    double tieSum = 0.0;
    int start = 0;
    while (start < order.length) {
      int end = start + 1;
      while (end < order.length && pooled.get(order[end]).compareTo(pooled.get(order[start])) == 0) {
        end++;
      }
      double averageRank = (start + 1 + end) / 2.0;
      for (int k = start; k < end; k++) {
        ranks[order[k]] = averageRank;
      }
      double ties = end - start;
      tieSum += ties * ties * ties - ties;
      start = end;
    }
    return new Ranking(ranks, tieSum);
  }

  private record Ranking(double[] ranks, double tieSum) {}
}
