package com.goparser.ast;

public sealed interface Decl extends Node permits BadDecl, GenDecl, FuncDecl {
}
