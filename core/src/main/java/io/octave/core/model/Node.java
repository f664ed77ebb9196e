package io.octave.core.model;

import java.util.List;

/** A structural element of a document body. */
public sealed interface Node permits Assignment, Comment, Container {

    /** Key of the node; empty for comments and for bare literal zones. */
    String key();

    /** 1-based source line, or 0 for nodes built in code. */
    int line();

    /** Comment lines written directly above the node, without the {@code //} prefix. */
    List<String> leadingComments();
}
