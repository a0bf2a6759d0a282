package ai.callgraph.ast;

import org.jetbrains.annotations.Nullable;

/** A keyword argument {@code arg=value}, or {@code **value} when {@code arg} is null. */
public record Keyword(@Nullable String arg, Expr value) {}
