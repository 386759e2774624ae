package com.sedmap.service;

import com.sedmap.model.ResultMap;
import java.io.BufferedOutputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import nom.tam.fits.BasicHDU;
import nom.tam.fits.Fits;
import nom.tam.fits.FitsException;
import nom.tam.fits.Header;

public class FitsMapWriter {

    public void write(ResultMap map, File output) throws IOException, FitsException {
        try (Fits fits = new Fits()) {
            BasicHDU<?> hdu = Fits.makeHDU(map.getData());
            Header header = hdu.getHeader();
            if (map.unit != null && !map.unit.isEmpty()) header.addValue("BUNIT", map.unit, "physical unit of the map");
            header.addValue("PARAM", map.name, "results column the map was built from");
            fits.addHDU(hdu);
            write(fits, output);
        }
    }

    static void write(Fits fits, File output) throws IOException, FitsException {
        File parent = output.getAbsoluteFile().getParentFile();
        if (parent != null && !parent.isDirectory() && !parent.mkdirs()) {
            throw new IOException("Cannot create directory " + parent);
        }
        try (DataOutputStream out = new DataOutputStream(new BufferedOutputStream(new FileOutputStream(output)))) {
            fits.write(out);
        }
    }
}
