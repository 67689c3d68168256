package com.strmatch.classify;

/**
 * Assigns a label to a string by evaluating matcher rules.
 */
public interface StringClassifier {

    /**
     * Classify the given string.
     *
     * @param input String to classify
     * @return Classification result, never null
     */
    ClassificationResult classify(String input);

    /**
     * Get the classifier name.
     */
    String getName();
}
