package work.leyline.cli;

/** What the command prints for the parsed document. */
enum EmitMode {
    TOKENS,
    TREE,
    JSON,
    CONTEXTS
}
