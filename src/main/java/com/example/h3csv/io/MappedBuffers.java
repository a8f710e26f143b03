package com.example.h3csv.io;

import lombok.extern.slf4j.Slf4j;

import java.lang.reflect.Field;
import java.lang.reflect.Method;
import java.nio.ByteBuffer;
import java.nio.MappedByteBuffer;

/**
 * Releases the off-heap region behind a {@link MappedByteBuffer} without waiting for GC.
 * Best effort: when no cleaner is reachable the region is left to the collector.
 */
@Slf4j
final class MappedBuffers {

    private static volatile boolean warned;

    private MappedBuffers() {}

    static void release(MappedByteBuffer buffer) {
        if (buffer == null) {
            return;
        }
        if (invokeUnsafeCleaner(buffer) || invokeBufferCleaner(buffer)) {
            return;
        }
        if (!warned) {
            warned = true;
            log.warn("Unable to unmap file regions explicitly, they will be reclaimed by GC");
        }
    }

    // JDK 9+: sun.misc.Unsafe.invokeCleaner(ByteBuffer)
    private static boolean invokeUnsafeCleaner(MappedByteBuffer buffer) {
        try {
            Class<?> unsafeClass = Class.forName("sun.misc.Unsafe");
            Field theUnsafe = unsafeClass.getDeclaredField("theUnsafe");
            theUnsafe.setAccessible(true);
            Method invokeCleaner = unsafeClass.getMethod("invokeCleaner", ByteBuffer.class);
            invokeCleaner.invoke(theUnsafe.get(null), buffer);
            return true;
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.trace("Unsafe.invokeCleaner unavailable: {}", e.toString());
            return false;
        }
    }

    // JDK 8: DirectByteBuffer.cleaner().clean()
    private static boolean invokeBufferCleaner(MappedByteBuffer buffer) {
        try {
            Method cleanerMethod = buffer.getClass().getMethod("cleaner");
            cleanerMethod.setAccessible(true);
            Object cleaner = cleanerMethod.invoke(buffer);
            if (cleaner == null) {
                return false;
            }
            Method clean = cleaner.getClass().getMethod("clean");
            clean.setAccessible(true);
            clean.invoke(cleaner);
            return true;
        } catch (ReflectiveOperationException | RuntimeException e) {
            log.trace("buffer.cleaner() unavailable: {}", e.toString());
            return false;
        }
    }
}
