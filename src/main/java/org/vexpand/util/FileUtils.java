package org.vexpand.util;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

public class FileUtils
{
	public static String load(Path filePath) throws IOException
	{
		return Files.readString(filePath);
	}

	public static String getFileExtension(Path path)
	{
		String fileName = path.getFileName().toString();
		int lastDotIndex = fileName.lastIndexOf('.');
		if (lastDotIndex > 0)
		{
			return fileName.substring(lastDotIndex);
		}
		return null;
	}

	/**
	 * Replaces the extension of {@code path} (if any) with {@code newExtension}.
	 */
	public static Path withExtension(Path path, String newExtension)
	{
		String baseName = path.getFileName().toString().replaceFirst("[.][^.]+$", "");
		return path.resolveSibling(baseName + newExtension);
	}
}
