package com.eainde.verity.knowledge;

public record ActionTemplate(String instruction, String verificationMethod) {
}
