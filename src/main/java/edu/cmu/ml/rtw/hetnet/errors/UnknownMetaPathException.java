package edu.cmu.ml.rtw.hetnet.errors;

public class UnknownMetaPathException extends HetnetException {
  private static final long serialVersionUID = 1L;

  public UnknownMetaPathException(String message) {
    super(message);
  }
}
