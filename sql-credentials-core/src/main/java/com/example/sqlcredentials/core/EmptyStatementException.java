package com.example.sqlcredentials.core;

/** A creation batch contained no usable statement, so no credentials could be granted. */
public class EmptyStatementException extends CredentialException {

  public EmptyStatementException() {
    super("empty creation statements");
  }
}
