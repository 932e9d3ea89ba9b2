package contentmodel.graph;

/**
 * What to do with an all group that has more children than the configured
 * permutation limit.
 *
 * <p>All groups are expanded into a choice over every ordering of their
 * children, so the NFA grows factorially with the size of the group (before
 * minimization shrinks it back down).
 */
public enum AllGroupOverflow {
  /**
   * Fail the build before expanding any permutation.
   */
  REJECT,

  /**
   * Log a warning and expand the group anyway.
   */
  WARN
}
