package com.fundermatch.matching.model;

import java.util.List;

public record MatchResponse(boolean success, List<FunderMatch> matches, String message) {
}
