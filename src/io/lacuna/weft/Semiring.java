package io.lacuna.weft;

/**
 * The ways values of transitions can be combined along and across paths.
 */
public enum Semiring {

  /**
   * Ordinary probabilities: values are multiplied along a path and summed across paths.
   */
  PRODUCT {
    @Override
    public double zero() {
      return 0.0;
    }

    @Override
    public double one() {
      return 1.0;
    }

    @Override
    public double plus(double a, double b) {
      return a + b;
    }

    @Override
    public double times(double a, double b) {
      return a * b;
    }
  },

  /**
   * Log probabilities: values are added along a path and combined across paths with log-sum-exp.
   */
  LOG {
    @Override
    public double zero() {
      return Double.NEGATIVE_INFINITY;
    }

    @Override
    public double one() {
      return 0.0;
    }

    @Override
    public double plus(double a, double b) {
      return Utils.logAddExp(a, b);
    }

    @Override
    public double times(double a, double b) {
      return a + b;
    }
  };

  public abstract double zero();

  public abstract double one();

  public abstract double plus(double a, double b);

  public abstract double times(double a, double b);
}
