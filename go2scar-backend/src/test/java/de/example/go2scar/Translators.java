package de.example.go2scar;

/**
 * Wires the translator components by hand, the way the Spring context does.
 */
public final class Translators {

  private Translators() {
  }

  public static ExpressionTranslator expressions() {
    TypeMapper types = new TypeMapper();
    return new ExpressionTranslator(types, new BuiltinCalls(types));
  }

  public static StatementEmitter statements() {
    TypeMapper types = new TypeMapper();
    return new StatementEmitter(new ExpressionTranslator(types, new BuiltinCalls(types)), types);
  }

  public static DeclarationEmitter declarations() {
    return new DeclarationEmitter(statements(), new TypeMapper());
  }

  public static GoToScarTranslator translator() {
    return new GoToScarTranslator(new ImportMapper(), declarations());
  }
}
