package org.broadinstitute.wombat;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.StringUtil;
import org.broadinstitute.barclay.argparser.CommandLineException;
import org.broadinstitute.barclay.argparser.CommandLineProgramGroup;
import org.broadinstitute.barclay.argparser.CommandLineProgramProperties;
import org.broadinstitute.wombat.cmdline.CommandLineProgram;
import org.broadinstitute.wombat.cmdline.StandardArgumentDefinitions;
import org.broadinstitute.wombat.exceptions.UserException;
import org.broadinstitute.wombat.tools.curation.CurateContigs;
import org.broadinstitute.wombat.tools.homology.AnnotateHomologyHits;
import org.broadinstitute.wombat.tools.pipeline.RunAssemblyPipeline;
import org.broadinstitute.wombat.utils.Utils;
import org.broadinstitute.wombat.utils.config.ConfigFactory;

import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.util.*;

/**
 * This is the main class of Wombat and is the way of executing individual command line programs.
 *
 * The first argument names the program, by its simple class name; the rest are handed to it.
 */
public class Main {

    static {
        /**
         * The very first thing that any Wombat application does is forces the JVM locale into US English, so that we don't have
         * to think about number formatting issues.
         */
        Utils.forceJVMLocaleToUSEnglish();
    }

    /**
     * Provides ANSI colors for the terminal output *
     */
    private static final String KNRM = "\u001B[0m"; // reset
    private static final String RED = "\u001B[31m";
    private static final String GREEN = "\u001B[32m";
    private static final String CYAN = "\u001B[36m";
    private static final String WHITE = "\u001B[37m";
    private static final String BOLDRED = "\u001B[1m\u001B[31m";

    /**
     * exit value when an issue with the commandline is detected, ie CommandLineException.
     */
    public static final int COMMANDLINE_EXCEPTION_EXIT_VALUE = 1;

    /**
     * Exit value when an unrecoverable {@link UserException} occurs.
     */
    public static final int USER_EXCEPTION_EXIT_VALUE = 2;

    /**
     * exit value when any unrecoverable exception other than {@link UserException} occurs
     */
    public static final int ANY_OTHER_EXCEPTION_EXIT_VALUE = 3;

    private static final String STACK_TRACE_ON_USER_EXCEPTION_PROPERTY = "WOMBAT_STACKTRACE_ON_USER_EXCEPTION";

    /**
     * similarity floor for matching in getSuggestedAlternateCommand *
     */
    private static final int HELP_SIMILARITY_FLOOR = 7;
    private static final int MINIMUM_SUBSTRING_LENGTH = 5;

    /**
     * Prints the given message (may be null) to the provided stream, adding adornments and formatting.
     */
    protected static void printDecoratedExceptionMessage(final PrintStream ps, final Exception e, String prefix){
        Utils.nonNull(ps, "stream");
        Utils.nonNull(e, "exception");
        ps.println("***********************************************************************");
        ps.println();
        ps.println(prefix + e.getMessage());
        ps.println();
        ps.println("***********************************************************************") ;
    }

    /**
     * The programs we wish to include in our command line.
     */
    protected List<Class<? extends CommandLineProgram>> getClassList() {
        return Arrays.asList(RunAssemblyPipeline.class, CurateContigs.class, AnnotateHomologyHits.class);
    }

    /** Returns the command line that will appear in the usage. */
    protected String getCommandLineName() {
        return "wombat";
    }

    /**
     * This method is not intended to be used outside of Wombat and its tests.
     *
     * @return the result of the program, or {@code null} when no program was named
     */
    public Object instanceMain(final String[] args) {
        final CommandLineProgram program = extractCommandLineProgram(args, getClassList(), getCommandLineName());
        return runCommandLineProgram(program, args);
    }

    /**
     * Run the given command line program with the raw arguments from the command line
     * @param rawArgs these are the raw arguments from the command line, the first will be stripped off
     * @return the result of running  {program} with the given args, possibly null
     */
    protected static Object runCommandLineProgram(final CommandLineProgram program, final String[] rawArgs) {
        if (null == program) return null; // no program found!  This will happen if help was specified with no other arguments
        final String[] mainArgs = Arrays.copyOfRange(rawArgs, 1, rawArgs.length);
        return program.instanceMain(mainArgs);
    }

    /**
     * The entry point to the toolkit from commandline: it runs the command line program and handles the returned
     * object with {@link #handleResult(Object)}, and exit with 0.
     * If any error occurs, it handles the exception and exits with the concrete error exit value.
     *
     * Note: this is the only method that is allowed to call System.exit (because tools may be run from test harness etc)
     */
    protected final void mainEntry(final String[] args) {
        System.exit(runAndGetExitValue(args));
    }

    @VisibleForTesting
    final int runAndGetExitValue(final String[] args) {
        CommandLineProgram program = null;
        try {
            program = extractCommandLineProgram(args, getClassList(), getCommandLineName());
            final Object result = runCommandLineProgram(program, args);
            handleResult(result);
            return 0;
        } catch (final CommandLineException e){
            if (program != null) {
                System.err.println(program.getUsage());
            }
            handleUserException(e, args);
            return COMMANDLINE_EXCEPTION_EXIT_VALUE;
        } catch (final UserException e){
            handleUserException(e, args);
            return USER_EXCEPTION_EXIT_VALUE;
        } catch (final Exception e){
            handleNonUserException(e);
            return ANY_OTHER_EXCEPTION_EXIT_VALUE;
        }
    }

    /**
     * Handle the result returned for a tool. Default implementation prints a message with the string value of the object if it is not null.
     * @param result the result of the tool (may be null)
     */
    protected void handleResult(final Object result) {
        if (result != null) {
            System.out.println("Tool returned:\n" + result);
        }
    }

    /**
     * Handle an exception that was likely caused by user error.
     * This includes {@link UserException} and {@link CommandLineException}
     *
     * Default implementation produces a pretty error message
     * and a stack trace iff {@link #printStackTraceOnUserExceptions(String[])}
     *
     * @param e the exception to handle
     * @param args the arguments of the failed run, searched for a config file
     */
    protected void handleUserException(final Exception e, final String[] args) {
        printDecoratedExceptionMessage(System.err, e, "A USER ERROR has occurred: ");

        if(printStackTraceOnUserExceptions(args)) {
            e.printStackTrace();
        } else {
            System.err.println(String.format(
                    "Set the environment variable %s to true to print the stack trace.",
                    STACK_TRACE_ON_USER_EXCEPTION_PROPERTY));
        }
    }

    /**
     * Handle any exception that does not come from the user. Default implementation prints the stack trace.
     * @param exception the exception to handle (never an {@link UserException}).
     */
    protected void handleNonUserException(final Exception exception) {
        printDecoratedExceptionMessage(System.err, exception, "An ERROR has occurred: ");
        exception.printStackTrace();
    }

    /** The entry point to Wombat from commandline. It calls {@link #mainEntry(String[])} from this instance. */
    public static void main(final String[] args) {
        new Main().mainEntry(args);
    }

    @VisibleForTesting
    static boolean printStackTraceOnUserExceptions(final String[] args) {
        if ("true".equals(System.getenv(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY))
                || Boolean.getBoolean(STACK_TRACE_ON_USER_EXCEPTION_PROPERTY)) {
            return true;
        }
        String configFileName = null;
        try {
            configFileName = ConfigFactory.getConfigFilenameFromArgs(args, "--" + StandardArgumentDefinitions.WOMBAT_CONFIG_FILE_OPTION);
        } catch (final UserException.BadInput e) {
            // the run already failed on its arguments; the bundled defaults decide
        }
        return ConfigFactory.getInstance().createConfigFromFile(configFileName).wombat_stacktrace_on_user_exception();
    }

    /**
     * Returns the command line program specified, or prints the usage and returns {@code null} when no program or
     * help was requested.
     *
     * @throws UserException if the named program does not exist
     */
    private CommandLineProgram extractCommandLineProgram(final String[] args,
                                                         final List<Class<? extends CommandLineProgram>> classList,
                                                         final String commandLineName) {
        final Map<String, Class<? extends CommandLineProgram>> simpleNameToClass = new LinkedHashMap<>();
        for (final Class<? extends CommandLineProgram> clazz : classList) {
            if (getProgramProperty(clazz) == null) {
                throw new RuntimeException(String.format("The class '%s' is missing the required CommandLineProgramProperties annotation.", clazz.getSimpleName()));
            }
            simpleNameToClass.put(clazz.getSimpleName(), clazz);
        }

        if (args.length < 1 || args[0].equals("-h") || args[0].equals("--help")) {
            printUsage(System.out, simpleNameToClass.values(), commandLineName);
            return null;
        }
        final Class<? extends CommandLineProgram> clazz = simpleNameToClass.get(args[0]);
        if (clazz == null) {
            printUsage(System.err, simpleNameToClass.values(), commandLineName);
            throw new UserException(getSuggestedAlternateCommand(simpleNameToClass.keySet(), args[0]));
        }
        try {
            return clazz.getDeclaredConstructor().newInstance();
        } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
            throw new RuntimeException(e);
        }
    }

    public static CommandLineProgramProperties getProgramProperty(Class<?> clazz) {
        return clazz.getAnnotation(CommandLineProgramProperties.class);
    }

    private void printUsage(final PrintStream destinationStream, final Collection<Class<? extends CommandLineProgram>> classes,
                            final String commandLineName) {
        final StringBuilder builder = new StringBuilder();
        builder.append(BOLDRED + "USAGE: " + commandLineName + " " + GREEN + "<program name>" + BOLDRED + " [-h]\n\n" + KNRM)
                .append(BOLDRED + "Available Programs:\n" + KNRM);

        /** Group CommandLinePrograms by CommandLineProgramGroup **/
        final Map<Class<? extends CommandLineProgramGroup>, CommandLineProgramGroup> programGroupClassToProgramGroupInstance = new LinkedHashMap<>();
        final Map<CommandLineProgramGroup, List<Class<?>>> programsByGroup = new TreeMap<>(CommandLineProgramGroup.comparator);
        for (final Class<?> clazz : classes) {
            final CommandLineProgramProperties property = getProgramProperty(clazz);
            if (property.omitFromCommandLine()) {
                continue;
            }
            CommandLineProgramGroup programGroup = programGroupClassToProgramGroupInstance.get(property.programGroup());
            if (null == programGroup) {
                try {
                    programGroup = property.programGroup().getDeclaredConstructor().newInstance();
                } catch (final InstantiationException | IllegalAccessException | NoSuchMethodException | InvocationTargetException e) {
                    throw new RuntimeException(e);
                }
                programGroupClassToProgramGroupInstance.put(property.programGroup(), programGroup);
            }
            programsByGroup.computeIfAbsent(programGroup, g -> new ArrayList<>()).add(clazz);
        }

        /** Print out the programs in each group **/
        for (final Map.Entry<CommandLineProgramGroup, List<Class<?>>> entry : programsByGroup.entrySet()) {
            final CommandLineProgramGroup programGroup = entry.getKey();

            builder.append(WHITE + "--------------------------------------------------------------------------------------\n" + KNRM);
            builder.append(String.format("%s%-48s %-45s%s\n", RED, programGroup.getName() + ":", programGroup.getDescription(), KNRM));

            final List<Class<?>> sortedClasses = new ArrayList<>(entry.getValue());
            sortedClasses.sort(Comparator.comparing(Class::getSimpleName));

            for (final Class<?> clazz : sortedClasses) {
                builder.append(String.format("%s    %-45s%s%s%s\n", GREEN, clazz.getSimpleName(), CYAN,
                        getProgramProperty(clazz).oneLineSummary(), KNRM));
            }
            builder.append(String.format("\n"));
        }
        builder.append(WHITE + "--------------------------------------------------------------------------------------\n" + KNRM);
        destinationStream.println(builder.toString());
    }

    /**
     * When a command does not match any known command, searches for similar commands, using the same method as GIT *
     * @return returns an error message including the closes match if relevant.
     */
    @VisibleForTesting
    static String getSuggestedAlternateCommand(final Set<String> names, final String command) {
        final Map<String, Integer> distances = new LinkedHashMap<>();

        int bestDistance = Integer.MAX_VALUE;
        int bestN = 0;

        for (final String name : names) {
            final int distance;
            if (name.startsWith(command) || (MINIMUM_SUBSTRING_LENGTH <= command.length() && name.contains(command))) {
                distance = 0;
            } else {
                distance = StringUtil.levenshteinDistance(command, name, 0, 2, 1, 4);
            }
            distances.put(name, distance);

            if (distance < bestDistance) {
                bestDistance = distance;
                bestN = 1;
            } else if (distance == bestDistance) {
                bestN++;
            }
        }

        if (0 == bestDistance && bestN == names.size()) {
            bestDistance = HELP_SIMILARITY_FLOOR + 1;
        }

        final StringBuilder message = new StringBuilder();
        message.append(String.format("'%s' is not a valid command.", command));
        message.append(System.lineSeparator());
        if (bestDistance < HELP_SIMILARITY_FLOOR) {
            message.append(String.format("Did you mean %s?", (bestN < 2) ? "this" : "one of these"));
            message.append(System.lineSeparator());
            for (final String name : names) {
                if (bestDistance == distances.get(name)) {
                    message.append(String.format("        %s", name));
                }
            }
        }
        return message.toString();
    }
}
