package model;

/**
 * A kind-tagged record extracted from a solver run log by an upstream parser.
 * The overview layer only reads blocks; implementations must be immutable.
 */
public interface LogBlock {

    BlockKind getKind();
}
