package edu.brandeis.cosi103a.gokifu.web;

import edu.brandeis.cosi103a.gokifu.ConversionException;
import edu.brandeis.cosi103a.gokifu.UnknownFormatException;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * REST controller for record conversion endpoints.
 */
@RestController
@RequestMapping("/api")
public class ConversionController {

    static final MediaType SGF = MediaType.parseMediaType("application/x-go-sgf;charset=UTF-8");

    private final ConversionService conversionService;

    public ConversionController(ConversionService conversionService) {
        this.conversionService = conversionService;
    }

    /**
     * Lists the input formats the converter understands.
     */
    @GetMapping("/formats")
    public List<FormatInfo> listFormats() {
        return conversionService.listFormats();
    }

    /**
     * Converts a record sent as plain text in the given format.
     */
    @PostMapping(value = "/convert/{format}", consumes = MediaType.TEXT_PLAIN_VALUE)
    public ResponseEntity<String> convertText(@PathVariable String format, @RequestBody String body) {
        String sgf = conversionService.convertText(format, body);
        return ResponseEntity.ok().contentType(SGF).body(sgf);
    }

    /**
     * Converts an uploaded record file; the format comes from the file's extension.
     */
    @PostMapping(value = "/convert", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public ResponseEntity<String> convertUpload(@RequestParam("file") MultipartFile file) throws IOException {
        String filename = file.getOriginalFilename() != null ? file.getOriginalFilename() : "";
        String sgf = conversionService.convertUpload(filename, file.getBytes());
        return ResponseEntity.ok()
                .contentType(SGF)
                .header(HttpHeaders.CONTENT_DISPOSITION,
                        "attachment; filename=\"" + conversionService.outputFilename(filename) + "\"")
                .body(sgf);
    }

    @ExceptionHandler(UnknownFormatException.class)
    public ResponseEntity<Map<String, String>> handleUnknownFormat(UnknownFormatException ex) {
        return ResponseEntity.badRequest().body(Map.of("error", ex.getMessage()));
    }

    @ExceptionHandler(ConversionException.class)
    public ResponseEntity<Map<String, String>> handleConversionFailure(ConversionException ex) {
        return ResponseEntity.status(HttpStatus.UNPROCESSABLE_ENTITY)
                .body(Map.of("error", ex.getMessage()));
    }
}
