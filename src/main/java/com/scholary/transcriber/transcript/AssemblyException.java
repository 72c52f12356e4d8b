package com.scholary.transcriber.transcript;

import com.scholary.transcriber.exception.ErrorKind;
import com.scholary.transcriber.exception.TranscriptionException;

/** Thrown when chunk results reach the assembler out of order or with gaps. */
public class AssemblyException extends TranscriptionException {

  public AssemblyException(String message) {
    super(ErrorKind.ASSEMBLY_ERROR, message);
  }
}
