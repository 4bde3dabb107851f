package com.scholary.mix.analyzer.beat;

/**
 * Tracked beats of one recording.
 *
 * @param beatTimes beat times in seconds, ascending
 * @param tempoBpm estimated tempo, 0 when no beats were found
 * @param beatsPerMeasure beats per bar; every such beat from the first is a downbeat
 */
public record BeatGrid(double[] beatTimes, double tempoBpm, int beatsPerMeasure) {

  public static BeatGrid empty(int beatsPerMeasure) {
    return new BeatGrid(new double[0], 0.0, beatsPerMeasure);
  }

  public boolean isEmpty() {
    return beatTimes.length == 0;
  }

  /** Every {@code beatsPerMeasure}-th beat, starting with the first one. */
  public double[] downbeats() {
    int count = (beatTimes.length + beatsPerMeasure - 1) / beatsPerMeasure;
    double[] downbeats = new double[count];
    for (int i = 0; i < count; i++) {
      downbeats[i] = beatTimes[i * beatsPerMeasure];
    }
    return downbeats;
  }
}
