package net.swapcurve.marketdata.risk;

import java.io.Serializable;

/**
 * Rate sensitivities of a swap: DV01 (change of value for a one basis point upward move of the par rates) and
 * Gamma (second difference of the value for one basis point moves).
 */
public class RiskMetrics implements Serializable {

	private static final long serialVersionUID = 8106543072619423957L;

	private final double dv01;
	private final double gamma;

	public RiskMetrics(double dv01, double gamma) {
		super();
		this.dv01 = dv01;
		this.gamma = gamma;
	}

	public double getDV01() {
		return dv01;
	}

	public double getGamma() {
		return gamma;
	}

	@Override
	public String toString() {
		return "RiskMetrics [dv01=" + dv01 + ", gamma=" + gamma + "]";
	}
}
