package org.blocksync.registry;

/**
 * The connection shape of a block kind.
 */
public enum BlockShape {
    /** Produces a value and plugs into value inputs. */
    VALUE,
    /** Chains with other statements and nests into statement inputs. */
    STATEMENT,
    /** A top-level container compiled to a named procedure plus its registration. */
    EVENT_HANDLER
}
