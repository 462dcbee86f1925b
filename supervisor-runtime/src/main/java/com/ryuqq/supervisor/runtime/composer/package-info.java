/**
 * Runner composition.
 *
 * <p>{@link com.ryuqq.supervisor.runtime.composer.Composer} runs several runners concurrently,
 * one thread each, and fans every external signal out to all of them. The first failure wins;
 * an {@link java.lang.Error} from any runner thread is rethrown once all threads are joined.</p>
 *
 * <p>Configuration lives in {@link com.ryuqq.supervisor.runtime.composer.ComposerConfig}.</p>
 */
package com.ryuqq.supervisor.runtime.composer;
