package my.finstatements.app.report;

public class FormattingRules {
	private String currencySymbol = "€";
	private Integer currencyDecimals = 0;
	private Integer percentDecimals = 1;
	private Integer decimalDecimals = 2;
	private Boolean thousandsSeparator = true;
	private Boolean negativeParentheses = false;

	public String getCurrencySymbol() {
		return currencySymbol;
	}

	public void setCurrencySymbol(String currencySymbol) {
		this.currencySymbol = currencySymbol;
	}

	public Integer getCurrencyDecimals() {
		return currencyDecimals;
	}

	public void setCurrencyDecimals(Integer currencyDecimals) {
		this.currencyDecimals = currencyDecimals;
	}

	public Integer getPercentDecimals() {
		return percentDecimals;
	}

	public void setPercentDecimals(Integer percentDecimals) {
		this.percentDecimals = percentDecimals;
	}

	public Integer getDecimalDecimals() {
		return decimalDecimals;
	}

	public void setDecimalDecimals(Integer decimalDecimals) {
		this.decimalDecimals = decimalDecimals;
	}

	public Boolean getThousandsSeparator() {
		return thousandsSeparator;
	}

	public void setThousandsSeparator(Boolean thousandsSeparator) {
		this.thousandsSeparator = thousandsSeparator;
	}

	public Boolean getNegativeParentheses() {
		return negativeParentheses;
	}

	public void setNegativeParentheses(Boolean negativeParentheses) {
		this.negativeParentheses = negativeParentheses;
	}
}
