package sune.app.mediadown.eme;

import java.nio.file.Path;

import org.apache.log4j.AsyncAppender;
import org.apache.log4j.ConsoleAppender;
import org.apache.log4j.FileAppender;
import org.apache.log4j.PatternLayout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.event.Level;
import org.slf4j.helpers.NOPLoggerFactory;

public final class EMELog {
	
	private static final String PATTERN = "%d{yyyy-MM-dd HH:mm:ss.SSS} [%p|%C] %m%n";
	
	private static Logger loggerNrm;
	private static Logger loggerNop;
	private static volatile Logger logger;
	
	// Forbid anyone to create an instance of this class
	private EMELog() {
	}
	
	private static final void initializeNop() {
		if(loggerNop == null) {
			loggerNop = (new NOPLoggerFactory()).getLogger(EMELog.class.getName());
		}
	}
	
	private static final void initializeNrm() {
		if(loggerNrm == null) {
			loggerNrm = LoggerFactory.getLogger(EMELog.class);
		}
	}
	
	private static final org.apache.log4j.Logger internalLogger() {
		// Same name as the SLF4J logger, the binding delegates to this instance
		return org.apache.log4j.Logger.getLogger(EMELog.class);
	}
	
	private static final org.apache.log4j.Level internalLevel(Level level) {
		return org.apache.log4j.Level.toLevel(level.toString());
	}
	
	private static final void addConsoleAppender(org.apache.log4j.Logger logger, Level level) {
		org.apache.log4j.Level internalLevel = internalLevel(level);
		ConsoleAppender appender = new ConsoleAppender();
		appender.setLayout(new PatternLayout(PATTERN));
		appender.setThreshold(internalLevel);
		appender.activateOptions();
		logger.addAppender(appender);
		logger.setLevel(internalLevel);
	}
	
	private static final void addFileAppender(org.apache.log4j.Logger logger, Level level, Path file) {
		org.apache.log4j.Level internalLevel = internalLevel(level);
		FileAppender appender = new FileAppender();
		AsyncAppender asyncAppender = new AsyncAppender();
		asyncAppender.addAppender(appender);
		asyncAppender.setLocationInfo(true);
		appender.setFile(file.toAbsolutePath().toString());
		appender.setLayout(new PatternLayout(PATTERN));
		appender.setThreshold(internalLevel);
		appender.activateOptions();
		logger.addAppender(asyncAppender);
		logger.setLevel(internalLevel);
	}
	
	private static final void setLoggerPath(Level level, Path file) {
		org.apache.log4j.Logger internal = internalLogger();
		internal.removeAllAppenders();
		internal.setAdditivity(false);
		if(file == null) addConsoleAppender(internal, level);
		else addFileAppender(internal, level, file);
	}
	
	public static final void enable(boolean isDebug, Path file) {
		enable(isDebug ? Level.DEBUG : Level.ERROR, file);
	}
	
	public static final synchronized void enable(Level level, Path file) {
		initializeNrm();
		setLoggerPath(level, file);
		logger = loggerNrm;
	}
	
	/**
	 * Silences the controller log. Classes that already obtained the logger keep
	 * the SLF4J instance, therefore the underlying Log4j logger is turned off too.
	 */
	public static final synchronized void disable() {
		initializeNop();
		internalLogger().setLevel(org.apache.log4j.Level.OFF);
		logger = loggerNop;
	}
	
	public static final Logger get() {
		Logger current;
		if((current = logger) == null) {
			synchronized(EMELog.class) {
				if((current = logger) == null) {
					initializeNrm();
					logger = current = loggerNrm;
				}
			}
		}
		return current;
	}
}
