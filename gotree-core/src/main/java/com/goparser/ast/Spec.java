package com.goparser.ast;

/**
 * A single entry of a generic declaration: an import, a constant or variable, or a type.
 */
public sealed interface Spec extends Node permits ImportSpec, ValueSpec, TypeSpec {
}
