package com.sceneit.engine.model.element;

/** A spoken line or a parenthetical direction inside a dialogue. */
public sealed interface DialogueBlock permits DialogueText, Parenthetical {

    String text();
}
