package my.finstatements.app.ltm;

public record LatestPeriod(int year, int period) {
}
