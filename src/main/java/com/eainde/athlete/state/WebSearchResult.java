package com.eainde.athlete.state;

import java.io.Serializable;

public record WebSearchResult(String url, String title, String content, double score) implements Serializable {
}
