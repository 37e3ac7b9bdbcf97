package com.loadspec.model.parse;

public enum HintKind {
    METHOD, URL, HEADERS, BODY, COUNT
}
