package com.smurthy.ai.insights.filter;

import com.smurthy.ai.insights.extract.SemanticRow;

import java.time.LocalDate;

public record DatedRow(LocalDate date, SemanticRow row) {
}
