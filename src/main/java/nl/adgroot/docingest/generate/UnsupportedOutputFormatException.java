package nl.adgroot.docingest.generate;

/** Thrown when a document generator is asked for a format it cannot produce. */
public class UnsupportedOutputFormatException extends UnsupportedOperationException {

  public UnsupportedOutputFormatException(String format) {
    super("Output format " + format + " not supported");
  }
}
