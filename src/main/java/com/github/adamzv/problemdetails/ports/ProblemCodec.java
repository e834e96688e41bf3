package com.github.adamzv.problemdetails.ports;

import com.github.adamzv.problemdetails.domain.ProblemDetails;
import com.github.adamzv.problemdetails.domain.ProblemDetailsException;
import com.github.adamzv.problemdetails.domain.ProblemFormat;

public interface ProblemCodec {

  ProblemFormat format();

  default String contentType() {
    return format().contentType();
  }

  byte[] encode(ProblemDetails problem);

  ProblemDetails decode(byte[] document) throws ProblemDetailsException;
}
