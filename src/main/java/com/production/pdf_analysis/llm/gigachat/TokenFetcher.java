package com.production.pdf_analysis.llm.gigachat;

@FunctionalInterface
public interface TokenFetcher {

    AccessToken fetch();
}
