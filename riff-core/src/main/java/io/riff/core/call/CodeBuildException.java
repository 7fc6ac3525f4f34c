package io.riff.core.call;

public class CodeBuildException extends Exception {

    public CodeBuildException(String message) {
        super(message);
    }
}
