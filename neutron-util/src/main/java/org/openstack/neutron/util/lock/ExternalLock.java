/*
 * Copyright 2016 Midokura SARL
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.openstack.neutron.util.lock;

import java.io.File;
import java.io.IOException;
import java.io.RandomAccessFile;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.openstack.neutron.config.ConfigOpts;

/**
 * A lock shared between processes, backed by a file lock in the directory
 * named by the {@code lock_path} option of the {@code oslo_concurrency}
 * group.
 */
public class ExternalLock implements AutoCloseable {

    private static final Logger log =
        LoggerFactory.getLogger(ExternalLock.class);

    public static final String GROUP = "oslo_concurrency";
    public static final String LOCK_PATH = "lock_path";

    private final File file;
    private RandomAccessFile raf;
    private FileLock lock;

    public ExternalLock(File directory, String name) {
        this.file = new File(directory, name + ".lock");
    }

    /**
     * @throws IllegalStateException if {@code lock_path} is not set
     */
    public static ExternalLock create(ConfigOpts conf, String name) {
        String lockPath = conf.getValue(GROUP, LOCK_PATH, (String) null);
        if (lockPath == null) {
            throw new IllegalStateException(
                "Required option " + GROUP + "." + LOCK_PATH + " is not set");
        }
        return new ExternalLock(new File(lockPath), name);
    }

    public File getFile() {
        return file;
    }

    @SuppressWarnings("ResultOfMethodCallIgnored")
    public synchronized void lock() {
        try {
            file.getParentFile().mkdirs();
            raf = new RandomAccessFile(file, "rw");
            lock = raf.getChannel().lock();
            log.trace("Acquired external lock {}", file);
        } catch (IOException ex) {
            throw new IllegalStateException(
                "Could not lock on file: " + file.getAbsolutePath(), ex);
        }
    }

    public synchronized boolean tryLock() {
        try {
            file.getParentFile().mkdirs();
            raf = new RandomAccessFile(file, "rw");
            FileChannel channel = raf.getChannel();
            lock = channel.tryLock();
        } catch (OverlappingFileLockException ex) {
            lock = null;
        } catch (IOException ex) {
            throw new IllegalStateException(
                "Could not lock on file: " + file.getAbsolutePath(), ex);
        }
        if (lock == null) {
            closeFile();
        }
        return lock != null;
    }

    public synchronized boolean isHeld() {
        return lock != null && lock.isValid();
    }

    public synchronized void release() {
        try {
            if (lock != null) {
                lock.release();
            }
        } catch (IOException e) {
            log.error("Exception while releasing a file system lock.", e);
        } finally {
            lock = null;
            closeFile();
        }
    }

    @Override
    public void close() {
        release();
    }

    private void closeFile() {
        if (raf == null) {
            return;
        }
        try {
            raf.close();
        } catch (IOException e) {
            log.warn("Cannot close lock file {}", file, e);
        }
        raf = null;
    }
}
