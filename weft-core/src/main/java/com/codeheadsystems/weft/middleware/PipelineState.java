package com.codeheadsystems.weft.middleware;

/**
 * Phases a single exchange passes through in {@link MiddlewarePipeline#execute}.
 */
public enum PipelineState {
  PENDING,
  REQUEST_PHASE,
  DISPATCH,
  RESPONSE_PHASE,
  DONE
}
