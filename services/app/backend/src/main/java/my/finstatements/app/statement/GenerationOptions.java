package my.finstatements.app.statement;

import my.finstatements.app.hierarchy.HierarchyNode;

/**
 * What the caller selected. {@code period2} is the comparison column and may be null; an
 * LTM option in either slot switches the statement to rolling monthly columns.
 */
public record GenerationOptions(String period1, String period2, ViewType viewType, int detailLevel) {

	public GenerationOptions {
		viewType = viewType == null ? ViewType.CUMULATIVE : viewType;
		if (detailLevel < 0 || detailLevel > HierarchyNode.ACCOUNT_LEVEL) {
			detailLevel = HierarchyNode.ACCOUNT_LEVEL;
		}
	}

	public static GenerationOptions compare(String period1, String period2) {
		return new GenerationOptions(period1, period2, ViewType.CUMULATIVE, HierarchyNode.ACCOUNT_LEVEL);
	}

	public static GenerationOptions ltm(String option) {
		return new GenerationOptions(option, null, ViewType.PERIOD, HierarchyNode.ACCOUNT_LEVEL);
	}

	public GenerationOptions withDetailLevel(int level) {
		return new GenerationOptions(period1, period2, viewType, level);
	}

	public GenerationOptions withViewType(ViewType type) {
		return new GenerationOptions(period1, period2, type, detailLevel);
	}
}
