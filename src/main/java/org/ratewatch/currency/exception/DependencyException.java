package org.ratewatch.currency.exception;

/**
 * A required collaborator (cache, ban store or upstream HTTP service) failed, timed out or
 * answered with something unusable.
 */
public abstract class DependencyException extends ServiceException {

  protected DependencyException(String message, String code) {
    super(message, code);
  }

  protected DependencyException(String message, String code, Throwable cause) {
    super(message, code, cause);
  }
}
