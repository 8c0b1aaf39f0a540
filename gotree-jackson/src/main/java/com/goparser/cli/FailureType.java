package com.goparser.cli;

/**
 * Why a source unit produced no output document.
 */
public enum FailureType {
    PATH,
    PARSE,
    UNSUPPORTED_NODE_KIND,
    ENCODE,
    WRITE
}
