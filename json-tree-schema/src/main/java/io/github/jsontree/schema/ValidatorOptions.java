package io.github.jsontree.schema;

/// Options for a [JsonSchemaValidator].
///
/// @param assertFormats when `false`, `format` names are still checked
///                      against the registry but values are not tested
public record ValidatorOptions(boolean assertFormats) {

  /// Default options with format assertion enabled
  public static final ValidatorOptions DEFAULT = new ValidatorOptions(true);

  public ValidatorOptions withAssertFormats(boolean assertFormats) {
    return new ValidatorOptions(assertFormats);
  }

  String summary() {
    return "assertFormats=" + assertFormats;
  }
}
