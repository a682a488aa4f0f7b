package de.bsommerfeld.cortx.supervisor.command;

/**
 * One command-line parameter of a script, as detected from its help output or
 * entered by the user.
 *
 * @param name      key into the parameter value map
 * @param type      value type; {@link ScriptParamType#BOOL} parameters are
 *                  plain switches
 * @param longFlag  e.g. {@code --verbose}, may be {@code null}
 * @param shortFlag e.g. {@code -v}, may be {@code null}
 * @param nargs     argparse-style arity ({@code +}, {@code *}, ...); when set
 *                  the value is split on whitespace. May be {@code null}.
 */
public record ScriptParameter(String name, ScriptParamType type, String longFlag, String shortFlag,
        String nargs) {

    public static ScriptParameter flag(String name, String longFlag) {
        return new ScriptParameter(name, ScriptParamType.BOOL, longFlag, null, null);
    }

    public static ScriptParameter option(String name, String longFlag) {
        return new ScriptParameter(name, ScriptParamType.STRING, longFlag, null, null);
    }

    public static ScriptParameter positional(String name) {
        return new ScriptParameter(name, ScriptParamType.STRING, null, null, null);
    }

    /** Long flag if present, otherwise the short flag, otherwise {@code null}. */
    String preferredFlag() {
        return longFlag != null ? longFlag : shortFlag;
    }
}
