package com.libragraph.contentstore.api;

import com.libragraph.contentstore.core.asset.Asset;
import com.libragraph.contentstore.core.asset.AssetPipeline;
import io.smallrye.mutiny.Uni;
import jakarta.inject.Inject;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.QueryParam;
import jakarta.ws.rs.core.MediaType;
import org.jboss.resteasy.reactive.RestForm;
import org.jboss.resteasy.reactive.multipart.FileUpload;

import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Accepts multipart asset uploads and answers with each original file name
 * mapped to its public, fingerprinted URL.
 *
 * <p>With {@code ?named=true} every asset is also registered in the asset
 * directory under its form field name.
 */
@Path("/assets")
@Produces(MediaType.APPLICATION_JSON)
public class AssetResource {

    @Inject
    AssetPipeline pipeline;

    @POST
    @Consumes(MediaType.MULTIPART_FORM_DATA)
    public Uni<Map<String, String>> accept(@RestForm(FileUpload.ALL) List<FileUpload> files,
                                           @QueryParam("named") boolean named) {
        List<Asset> assets = new ArrayList<>(files.size());
        for (FileUpload file : files) {
            assets.add(toAsset(file));
        }
        return publish(assets, named);
    }

    Uni<Map<String, String>> publish(List<Asset> assets, boolean named) {
        return pipeline.accept(assets, named)
                .onItem().transform(summary -> summary.publicUrls());
    }

    static Asset toAsset(FileUpload file) {
        String originalName = file.fileName() != null && !file.fileName().isBlank()
                ? file.fileName() : file.name();
        return new Asset(file.name(), originalName, file.contentType(), file.size(),
                () -> Files.newInputStream(file.uploadedFile()));
    }
}
