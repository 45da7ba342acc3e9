package com.emberscript.cli;

import ember.runtime.EmberException;
import ember.runtime.debug.JsonImporter;
import ember.runtime.debug.JsonRenderer;
import ember.runtime.debug.ObjectDumper;
import ember.runtime.debug.ValueFormatter;
import ember.runtime.types.EmberObject;
import ember.runtime.types.Property;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * EmberScript 对象检查器 CLI 入口点（picocli）
 *
 * <p>把 JSON 文档加载为对象，按键序输出属性，并可以查询单个属性及其后继。</p>
 */
@Command(name = "ember", version = "EmberScript v0.1.0",
         mixinStandardHelpOptions = true,
         description = "加载 JSON 文档为对象并按属性名顺序输出")
public class Main implements Callable<Integer> {

    private static final Logger LOG = Logger.getLogger(Main.class.getName());

    /** 持有 logger 引用，避免 -v 设置的级别随 logger 被回收 */
    private static final Logger[] VERBOSE_LOGGERS = {
            Logger.getLogger("ember"), Logger.getLogger("com.emberscript")
    };

    enum Format { TEXT, JSON }

    @Option(names = {"-f", "--format"}, defaultValue = "TEXT",
            description = "输出格式（text, json），默认 ${DEFAULT-VALUE}")
    Format format;

    @Option(names = {"-k", "--key"}, description = "查询属性及其后继，可重复")
    List<String> keys;

    @Option(names = {"-v", "--verbose"}, description = "输出调试日志")
    boolean verbose;

    @Parameters(index = "0", paramLabel = "FILE", description = "JSON 文件，根必须是对象")
    Path file;

    @Spec
    CommandSpec spec;

    @Override
    public Integer call() {
        if (verbose) {
            enableVerboseLogging();
        }
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();

        EmberObject obj;
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            obj = new JsonImporter().load(reader);
        } catch (IOException | EmberException e) {
            LOG.log(Level.FINE, "Failed to load " + file, e);
            err.println("错误: 无法加载 " + file + ": " + e.getMessage());
            return 1;
        }

        if (format == Format.JSON) {
            out.println(new JsonRenderer(true).toJson(obj));
        } else {
            out.print(ObjectDumper.dump(obj));
        }
        if (keys != null) {
            for (String key : keys) {
                out.println(describeKey(obj, key));
            }
        }
        out.flush();
        return 0;
    }

    static String describeKey(EmberObject obj, String key) {
        Property prop = obj.getProperty(key);
        if (prop == null) {
            return key + ": <absent>";
        }
        Property next = obj.nextProperty(key);
        return key + ": " + ValueFormatter.format(prop.getValue())
                + " (next: " + (next != null ? next.getName() : "<none>") + ")";
    }

    private static void enableVerboseLogging() {
        ConsoleHandler handler = new ConsoleHandler();
        handler.setLevel(Level.FINE);
        for (Logger logger : VERBOSE_LOGGERS) {
            logger.setLevel(Level.FINE);
            logger.addHandler(handler);
        }
    }

    static CommandLine createCommandLine() {
        return new CommandLine(new Main()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    /** 输出与错误输出都按控制台编码写出 */
    static CommandLine createCommandLine(PrintStream out, PrintStream err, Charset consoleCharset) {
        CommandLine cmd = createCommandLine();
        cmd.setOut(new PrintWriter(new OutputStreamWriter(out, consoleCharset), true));
        cmd.setErr(new PrintWriter(new OutputStreamWriter(err, consoleCharset), true));
        return cmd;
    }

    public static void main(String[] args) {
        // Windows 控制台可能仍用 GBK，按 native.encoding 输出中文
        Charset consoleCharset = getConsoleCharset(System.getProperty("native.encoding"));
        PrintStream out = new PrintStream(System.out, true, consoleCharset);
        PrintStream err = new PrintStream(System.err, true, consoleCharset);
        System.setOut(out);
        System.setErr(err);

        int exitCode = createCommandLine(out, err, consoleCharset).execute(args);
        System.exit(exitCode);
    }

    /**
     * 控制台实际使用的字符编码。
     * native.encoding（Java 17+）反映操作系统原生编码，不可用时退回默认 charset。
     */
    static Charset getConsoleCharset(String nativeEncoding) {
        if (nativeEncoding != null) {
            try {
                if (Charset.isSupported(nativeEncoding)) {
                    return Charset.forName(nativeEncoding);
                }
            } catch (IllegalCharsetNameException e) {
                LOG.log(Level.FINE, "Illegal native.encoding: " + nativeEncoding, e);
            }
        }
        return Charset.defaultCharset();
    }
}
