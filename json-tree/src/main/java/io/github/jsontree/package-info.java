/// An immutable tree model for JSON data.
///
/// [io.github.jsontree.JsonValue] is a sealed union of six record kinds:
/// [io.github.jsontree.JsonNull], [io.github.jsontree.JsonBoolean],
/// [io.github.jsontree.JsonNumber], [io.github.jsontree.JsonString],
/// [io.github.jsontree.JsonArray] and [io.github.jsontree.JsonObject].
/// [io.github.jsontree.Json] builds trees from JSON text or from plain Java
/// collections.
package io.github.jsontree;
