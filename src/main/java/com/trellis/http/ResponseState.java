package com.trellis.http;

/** Lifecycle of a {@link Response} builder. It only ever moves from PENDING to SENT. */
public enum ResponseState {
  PENDING,
  SENT
}
