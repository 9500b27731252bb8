package com.growfolio.common.model;

/*
 * 09/18/2026 - 10:12 AM
 * @author Growfolio Engineering
 */

import com.growfolio.common.enums.TipCategory;

public record InvestingTip(String id, String title, String content, TipCategory category) {
}
