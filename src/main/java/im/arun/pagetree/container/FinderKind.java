package im.arun.pagetree.container;

/**
 * Whether a finder stops at the first match or collects every match.
 */
public enum FinderKind {
    ONE,
    ALL
}
