package com.flamingo.ai.docstructure.service.model;

/** Pipeline stages, in execution order. */
public enum Stage {
  VALIDATION("validation"),
  NORMALIZATION("normalization"),
  NOISE_REMOVAL("noise-removal"),
  SEGMENTATION("segmentation"),
  GROUPING("grouping");

  private final String tag;

  Stage(String tag) {
    this.tag = tag;
  }

  /** Metric tag value for this stage. */
  public String tag() {
    return tag;
  }
}
