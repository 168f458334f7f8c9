package br.edu.ifba.kgraph.registry;

/**
 * Writing system of a token run.
 */
public enum Script {
    /** Ideographs. A single character is already a word. */
    HAN,
    /** Katakana, including the prolonged sound mark. */
    KATAKANA,
    /** Hiragana: particles and inflections. */
    HIRAGANA,
    /** Letters and digits of every other script, lower-cased. */
    ALPHANUMERIC
}
