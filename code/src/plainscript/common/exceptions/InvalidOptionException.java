package plainscript.common.exceptions;

/**
 * A compiler setting had a missing or malformed value
 */
public class InvalidOptionException extends Exception {

  public InvalidOptionException(String msg) {
    super(msg);
  }

  private static final long serialVersionUID = 1L;
}
