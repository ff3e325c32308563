package sune.app.mediadown.eme.util;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public final class Futures {
	
	private static final CompletableFuture<Void> DONE = CompletableFuture.completedFuture(null);
	
	// Forbid anyone to create an instance of this class
	private Futures() {
	}
	
	public static final CompletableFuture<Void> done() {
		return DONE;
	}
	
	public static final Throwable unwrap(Throwable throwable) {
		Throwable current = throwable;
		while((current instanceof CompletionException || current instanceof ExecutionException)
				&& current.getCause() != null) {
			current = current.getCause();
		}
		return current;
	}
	
	public static final <T> CompletableFuture<T> call(FutureSupplier<T> supplier) {
		try {
			CompletableFuture<T> future = supplier.get();
			
			if(future == null) {
				return CompletableFuture.failedFuture(new IllegalStateException("Capability returned no result"));
			}
			
			return future;
		} catch(Exception ex) {
			return CompletableFuture.failedFuture(ex);
		}
	}
	
	@FunctionalInterface
	public static interface FutureSupplier<T> {
		
		CompletableFuture<T> get() throws Exception;
	}
}
