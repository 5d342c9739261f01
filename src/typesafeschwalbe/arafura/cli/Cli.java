package typesafeschwalbe.arafura.cli;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.Result;

public class Cli {

    private interface Argument {
        char shortName();
        String longName();
        String description();
        String valueDescription();
        boolean hasValue();
    }

    public static record OptionalArgument(
        char shortName, String longName, String description,
        String valueDescription
    ) implements Argument {
        @Override public boolean hasValue() { return true; }
    }

    public static record Flag(
        char shortName, String longName, String description
    ) implements Argument {
        @Override public boolean hasValue() { return false; }
        @Override public String valueDescription() { return null; }
    }


    public static class Values {

        private final Map<OptionalArgument, Optional<String>> optional;
        private final Map<Flag, Boolean> flags;
        private final List<String> free;

        private Values(
            Map<OptionalArgument, Optional<String>> optional,
            Map<Flag, Boolean> flags,
            List<String> free
        ) {
            this.optional = optional;
            this.flags = flags;
            this.free = free;
        }

        public Optional<String> get(OptionalArgument arg) {
            if(!this.optional.containsKey(arg)) {
                throw new IllegalArgumentException(
                    "The given argument was not registered!"
                );
            }
            return this.optional.get(arg);
        }

        public boolean get(Flag flag) {
            if(!this.flags.containsKey(flag)) {
                throw new IllegalArgumentException(
                    "The given flag was not registered!"
                );
            }
            return this.flags.get(flag);
        }

        public List<String> free() {
            return this.free;
        }

    }


    public static final Flag HELP = new Flag(
        'h', "help", "displays a list of all available arguments"
    );

    private final String usage;
    private final List<OptionalArgument> optional;
    private final List<Flag> flags;
    private final Set<String> registered;

    public Cli(String usage) {
        this.usage = usage;
        this.optional = new ArrayList<>();
        this.flags = new ArrayList<>();
        this.registered = new HashSet<>();
        this.add(HELP);
    }

    private void register(Argument arg) {
        if(this.registered.contains(arg.longName())) {
            throw new IllegalArgumentException(
                "The given argument was already registered!"
            );
        }
        this.registered.add(arg.longName());
    }

    public Cli add(OptionalArgument arg) {
        this.register(arg);
        this.optional.add(arg);
        return this;
    }

    public Cli add(Flag flag) {
        this.register(flag);
        this.flags.add(flag);
        return this;
    }

    private static <T> Result<T> usageError(String message) {
        return Result.ofError(new Error(Error.Kind.USAGE, message));
    }

    private Argument lookUpArgument(String longName) {
        for(OptionalArgument arg: this.optional) {
            if(arg.longName.equals(longName)) { return arg; }
        }
        for(Flag arg: this.flags) {
            if(arg.longName.equals(longName)) { return arg; }
        }
        return null;
    }

    private Argument lookUpArgument(char shortName) {
        for(OptionalArgument arg: this.optional) {
            if(arg.shortName == shortName) { return arg; }
        }
        for(Flag arg: this.flags) {
            if(arg.shortName == shortName) { return arg; }
        }
        return null;
    }

    private static void appendArgumentHelp(StringBuilder help, Argument arg) {
        String value = arg.hasValue()? " <" + arg.valueDescription() + ">" : "";
        help.append("    -").append(arg.shortName()).append(value).append("\n");
        help.append("    --").append(arg.longName()).append(value).append("\n");
        help.append("                ").append(arg.description()).append("\n");
    }

    public String help() {
        StringBuilder help = new StringBuilder();
        help.append("Usage: ").append(this.usage).append("\n");
        help.append("List of available arguments:\n");
        for(OptionalArgument arg: this.optional) {
            Cli.appendArgumentHelp(help, arg);
        }
        for(Flag arg: this.flags) {
            Cli.appendArgumentHelp(help, arg);
        }
        return help.toString();
    }

    public Result<Values> parse(String[] args) {
        Map<OptionalArgument, Optional<String>> optional = new HashMap<>();
        Map<Flag, Boolean> flags = new HashMap<>();
        List<String> free = new ArrayList<>();
        for(int argIdx = 0; argIdx < args.length; argIdx += 1) {
            String arg = args[argIdx];
            Argument argObj;
            if(arg.startsWith("--")) {
                argObj = this.lookUpArgument(arg.substring(2));
            } else if(arg.startsWith("-") && arg.length() > 1) {
                if(arg.length() > 2) {
                    return Cli.usageError("'" + arg + "' is not a valid argument");
                }
                argObj = this.lookUpArgument(arg.charAt(1));
            } else {
                free.add(arg);
                continue;
            }
            if(argObj == null) {
                return Cli.usageError("'" + arg + "' is not a valid argument");
            }
            if(argObj.hasValue()) {
                if(argIdx + 1 >= args.length
                        || args[argIdx + 1].startsWith("-")) {
                    return Cli.usageError(
                        "'" + arg + "' does not have a value specified"
                    );
                }
                argIdx += 1;
                optional.put((OptionalArgument) argObj, Optional.of(args[argIdx]));
            } else {
                flags.put((Flag) argObj, true);
            }
        }
        for(OptionalArgument arg: this.optional) {
            optional.putIfAbsent(arg, Optional.empty());
        }
        for(Flag arg: this.flags) {
            flags.putIfAbsent(arg, false);
        }
        return Result.ofValue(new Values(optional, flags, free));
    }

}
