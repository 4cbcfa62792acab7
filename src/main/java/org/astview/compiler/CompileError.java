/*
 * Copyright 2025 The AstView Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.astview.compiler;

import org.codehaus.groovy.control.CompilationFailedException;
import org.codehaus.groovy.control.MultipleCompilationErrorsException;
import org.codehaus.groovy.control.messages.Message;
import org.codehaus.groovy.control.messages.SyntaxErrorMessage;
import org.codehaus.groovy.syntax.SyntaxException;

/**
 * Thrown by {@link AstTreeSession#compile} when the source cannot be compiled through the requested
 * phase. Refers to the first error the compiler reported; lineNum and charPositionInLine are 0 if
 * that error has no source position.
 */
public class CompileError extends RuntimeException {
  public final String msg;
  public final int lineNum;
  public final int charPositionInLine;

  public CompileError(String msg, int lineNum, int charPositionInLine) {
    super(msg);
    this.msg = msg;
    this.lineNum = lineNum;
    this.charPositionInLine = charPositionInLine;
  }

  private CompileError(String msg, int lineNum, int charPositionInLine, Throwable cause) {
    this(msg, lineNum, charPositionInLine);
    initCause(cause);
  }

  /** Returns a CompileError describing the first error in {@code e}. */
  static CompileError from(CompilationFailedException e) {
    if (e instanceof MultipleCompilationErrorsException multiple) {
      for (Message message : multiple.getErrorCollector().getErrors()) {
        if (message instanceof SyntaxErrorMessage syntaxError) {
          SyntaxException cause = syntaxError.getCause();
          return new CompileError(
              cause.getOriginalMessage(), cause.getLine(), cause.getStartColumn(), e);
        }
      }
    }
    return new CompileError(String.valueOf(e.getMessage()), 0, 0, e);
  }

  @Override
  public String getMessage() {
    return String.format("%s (%s:%s)", msg, lineNum, charPositionInLine);
  }
}
